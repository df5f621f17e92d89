package uk.gegc.surveylink.features.onelink.application;

import java.time.Instant;

public record IssuedLink(
        Long linkId,
        String token,
        String url,
        Instant expiresAt
) {
}
