package uk.gegc.surveylink.features.onelink.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Data sealed inside a one-time link token.
 *
 * @param resourceId id of the survey the link grants access to
 * @param prefill    answers to prefill, keyed by question prefill key; never null, held in
 *                   {@link PrefillValues#canonical canonical} form
 * @param expiresAt  absolute expiry in epoch seconds
 * @param nonce      per-issuance unique value, keeps ciphertexts of identical links apart
 */
public record LinkPayload(
        long resourceId,
        Map<String, Object> prefill,
        long expiresAt,
        String nonce
) {

    public LinkPayload {
        prefill = PrefillValues.canonical(prefill);
    }

    public Instant expiresAtInstant() {
        return Instant.ofEpochSecond(expiresAt);
    }

    public boolean isExpiredAt(Instant now) {
        return now.getEpochSecond() > expiresAt;
    }
}
