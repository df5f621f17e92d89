package uk.gegc.surveylink.features.onelink.infra.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import uk.gegc.surveylink.features.onelink.application.TokenCodec;
import uk.gegc.surveylink.features.onelink.domain.exception.InvalidTokenException;
import uk.gegc.surveylink.features.onelink.domain.exception.TokenEncodingException;
import uk.gegc.surveylink.features.onelink.domain.model.LinkPayload;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Seals link payloads with AES-256-GCM.
 * Token layout: base64url-without-padding( iv[12] || ciphertext || tag[16] ).
 */
@Slf4j
public class AesGcmTokenCodec implements TokenCodec {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    static final int IV_LENGTH_BYTES = 12;
    private static final int AUTH_TAG_LENGTH_BITS = 128;
    static final int MIN_SEALED_LENGTH = IV_LENGTH_BYTES + AUTH_TAG_LENGTH_BITS / 8;

    private final SecureRandom secureRandom = new SecureRandom();
    private final LinkEncryptionKey key;
    private final ObjectMapper objectMapper;

    public AesGcmTokenCodec(LinkEncryptionKey key, ObjectMapper objectMapper) {
        if (key == null) {
            throw new IllegalArgumentException("key is required");
        }
        this.key = key;
        this.objectMapper = objectMapper;
    }

    @Override
    public String encode(LinkPayload payload) {
        byte[] plaintext;
        try {
            plaintext = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw new TokenEncodingException("Failed to serialize link payload", ex);
        }
        try {
            byte[] iv = new byte[IV_LENGTH_BYTES];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key.secretKey(), new GCMParameterSpec(AUTH_TAG_LENGTH_BITS, iv));
            byte[] cipherText = cipher.doFinal(plaintext);

            ByteBuffer buffer = ByteBuffer.allocate(iv.length + cipherText.length);
            buffer.put(iv);
            buffer.put(cipherText);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer.array());
        } catch (GeneralSecurityException ex) {
            throw new TokenEncodingException("Failed to seal link payload", ex);
        }
    }

    @Override
    public LinkPayload decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty");
        }
        byte[] decoded;
        try {
            decoded = Base64.getUrlDecoder().decode(token);
        } catch (IllegalArgumentException ex) {
            throw new InvalidTokenException("Token is not valid base64url", ex);
        }
        if (decoded.length < MIN_SEALED_LENGTH) {
            throw new InvalidTokenException("Token is too short");
        }

        byte[] plainBytes;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key.secretKey(),
                    new GCMParameterSpec(AUTH_TAG_LENGTH_BITS, decoded, 0, IV_LENGTH_BYTES));
            plainBytes = cipher.doFinal(decoded, IV_LENGTH_BYTES, decoded.length - IV_LENGTH_BYTES);
        } catch (AEADBadTagException ex) {
            throw new InvalidTokenException("Token failed authentication", ex);
        } catch (GeneralSecurityException ex) {
            throw new InvalidTokenException("Failed to decrypt token", ex);
        }

        try {
            LinkPayload payload = objectMapper.readValue(plainBytes, LinkPayload.class);
            if (payload.nonce() == null) {
                throw new InvalidTokenException("Token payload has no nonce");
            }
            return payload;
        } catch (IOException ex) {
            log.warn("Authenticated token carried an unreadable payload");
            throw new InvalidTokenException("Token payload is malformed", ex);
        }
    }
}
