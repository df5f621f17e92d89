package uk.gegc.surveylink.features.onelink.infra.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinkEncryptionKeyTest {

    @Test
    @DisplayName("fromConfiguredSecret: Base64 value decoding to 32 bytes is accepted")
    void fromConfiguredSecret_base64() {
        byte[] bytes = new byte[32];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) i;
        }
        String secret = Base64.getEncoder().encodeToString(bytes);

        LinkEncryptionKey key = LinkEncryptionKey.fromConfiguredSecret(secret);

        assertThat(key.secretKey().getEncoded()).isEqualTo(bytes);
        assertThat(key.secretKey().getAlgorithm()).isEqualTo("AES");
    }

    @Test
    @DisplayName("fromConfiguredSecret: raw 32-character string is used as key bytes")
    void fromConfiguredSecret_raw() {
        String secret = "0123456789abcdef0123456789abcdef";

        LinkEncryptionKey key = LinkEncryptionKey.fromConfiguredSecret(secret);

        assertThat(key.secretKey().getEncoded()).isEqualTo(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("fromConfiguredSecret: missing secret fails start-up")
    void fromConfiguredSecret_missing() {
        assertThatThrownBy(() -> LinkEncryptionKey.fromConfiguredSecret(""))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("encryption-key is required");
        assertThatThrownBy(() -> LinkEncryptionKey.fromConfiguredSecret(null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("fromConfiguredSecret: wrong length is rejected")
    void fromConfiguredSecret_wrongLength() {
        assertThatThrownBy(() -> LinkEncryptionKey.fromConfiguredSecret("too-short-secret"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("256 bits");
    }

    @Test
    @DisplayName("of: copies the bytes and enforces 32 bytes")
    void of_copiesAndValidates() {
        byte[] bytes = new byte[32];
        LinkEncryptionKey key = LinkEncryptionKey.of(bytes);
        bytes[0] = 9;

        assertThat(key.secretKey().getEncoded()[0]).isZero();
        assertThatThrownBy(() -> LinkEncryptionKey.of(new byte[16]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LinkEncryptionKey.of(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toString: never prints key material")
    void toString_hidesKey() {
        assertThat(LinkEncryptionKey.of(new byte[32]).toString()).isEqualTo("LinkEncryptionKey[AES-256]");
    }
}
