package uk.gegc.surveylink.features.onelink.application;

import java.time.Instant;
import java.util.Map;

public record LinkPreview(
        Long linkId,
        Long surveyId,
        Map<String, Object> prefill,
        Instant expiresAt
) {
}
