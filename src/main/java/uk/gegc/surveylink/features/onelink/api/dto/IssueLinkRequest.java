package uk.gegc.surveylink.features.onelink.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Map;

@Schema(name = "IssueLinkRequest", description = "Options for a new one-time survey link")
public record IssueLinkRequest(
        @Schema(description = "Answers to prefill, keyed by question prefill key", example = "{\"name\": \"Alice\"}")
        Map<String, Object> prefillData,

        @Schema(description = "Expiry instant; defaults to the configured horizon", example = "2026-12-31T00:00:00Z")
        Instant expiresAt
) {
}
