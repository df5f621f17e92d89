package uk.gegc.surveylink.features.onelink.application;

import uk.gegc.surveylink.features.onelink.domain.exception.InvalidTokenException;
import uk.gegc.surveylink.features.onelink.domain.exception.TokenEncodingException;
import uk.gegc.surveylink.features.onelink.domain.model.LinkPayload;

/**
 * Turns a {@link LinkPayload} into an opaque, authenticated, URL-safe string and back.
 */
public interface TokenCodec {

    /**
     * Encodes the payload. Two calls with the same payload never return the same token.
     *
     * @throws TokenEncodingException if the payload cannot be serialized or sealed
     */
    String encode(LinkPayload payload);

    /**
     * Decodes and authenticates a token. Never returns partially decrypted data.
     *
     * @throws InvalidTokenException if the token is malformed, truncated or fails authentication
     */
    LinkPayload decode(String token);
}
