package uk.gegc.surveylink.features.onelink.api.dto;

import java.time.Instant;
import java.util.Map;

public record LinkPreviewDto(
        Long linkId,
        Long surveyId,
        Map<String, Object> prefillData,
        Instant expiresAt
) {
}
