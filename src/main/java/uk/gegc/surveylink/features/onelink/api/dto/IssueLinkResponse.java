package uk.gegc.surveylink.features.onelink.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "IssueLinkResponse", description = "Issued one-time link. The token is only returned here.")
public record IssueLinkResponse(
        Long id,
        String token,
        String url,
        Instant expiresAt
) {
}
