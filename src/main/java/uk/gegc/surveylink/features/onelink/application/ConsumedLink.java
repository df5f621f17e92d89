package uk.gegc.surveylink.features.onelink.application;

import java.time.Instant;
import java.util.Map;

/**
 * What a {@link LinkAction} learns about the link it runs for.
 */
public record ConsumedLink(
        Long linkId,
        Long surveyId,
        Map<String, Object> prefill,
        Instant expiresAt
) {
}
