package uk.gegc.surveylink.features.onelink.infra.security;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * Immutable AES-256 key for sealing link tokens. Built once at start-up and handed to the codec.
 */
@Slf4j
public final class LinkEncryptionKey {

    public static final int KEY_BYTES = 32;

    private final SecretKey secretKey;

    private LinkEncryptionKey(byte[] keyBytes) {
        if (keyBytes.length != KEY_BYTES) {
            throw new IllegalArgumentException(
                    "Link encryption key must be exactly " + KEY_BYTES + " bytes, got " + keyBytes.length);
        }
        this.secretKey = new SecretKeySpec(keyBytes, "AES");
    }

    public static LinkEncryptionKey of(byte[] keyBytes) {
        if (keyBytes == null) {
            throw new IllegalArgumentException("Link encryption key is required");
        }
        return new LinkEncryptionKey(Arrays.copyOf(keyBytes, keyBytes.length));
    }

    /**
     * Parses a configured secret. A value decoding from Base64 to 32 bytes is used as is; otherwise
     * the UTF-8 bytes of the string must be exactly 32 bytes long.
     */
    public static LinkEncryptionKey fromConfiguredSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("surveylink.one-link.encryption-key is required");
        }
        byte[] raw = secret.getBytes(StandardCharsets.UTF_8);
        try {
            byte[] decoded = Base64.getDecoder().decode(secret);
            if (decoded.length == KEY_BYTES) {
                return new LinkEncryptionKey(decoded);
            }
        } catch (IllegalArgumentException ex) {
            log.debug("surveylink.one-link.encryption-key is not Base64, using raw bytes");
        }
        if (raw.length != KEY_BYTES) {
            throw new IllegalStateException(
                    "surveylink.one-link.encryption-key must supply exactly 256 bits, got " + raw.length * 8);
        }
        return new LinkEncryptionKey(raw);
    }

    SecretKey secretKey() {
        return secretKey;
    }

    @Override
    public String toString() {
        return "LinkEncryptionKey[AES-256]";
    }
}
