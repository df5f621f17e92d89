package uk.gegc.surveylink.features.onelink.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * Durable record of an issued one-time link. Source of truth for the used/unused state.
 * {@code used} only ever moves from false to true, and {@code usedAt} is set together with it.
 * Tokens grow with their prefill, so they are looked up through the fixed-size {@code tokenHash}.
 */
@Entity
@Table(name = "one_links", indexes = {
        @Index(name = "idx_one_links_survey_id", columnList = "survey_id"),
        @Index(name = "idx_one_links_expires_at", columnList = "expires_at"),
        @Index(name = "idx_one_links_used", columnList = "used")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class OneLink {

    /** Upper bound of the serialized prefill, the size of the {@code prefill_data} column. */
    public static final int MAX_PREFILL_LENGTH = 4000;

    /** Longest token a {@link #MAX_PREFILL_LENGTH} prefill can produce. */
    public static final int MAX_TOKEN_LENGTH = 16384;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "survey_id", nullable = false, updatable = false)
    private Long surveyId;

    @Column(name = "token", nullable = false, length = MAX_TOKEN_LENGTH, updatable = false)
    private String token; // encrypted payload, see TokenCodec

    @Setter(AccessLevel.NONE)
    @Column(name = "token_hash", nullable = false, unique = true, length = 64, updatable = false)
    private String tokenHash;

    @Convert(converter = PrefillDataConverter.class)
    @Column(name = "prefill_data", length = MAX_PREFILL_LENGTH, updatable = false)
    private Map<String, Object> prefillData = new HashMap<>();

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "used", nullable = false)
    private boolean used;

    @Column(name = "used_at")
    private Instant usedAt;

    @Column(name = "accessed_at")
    private Instant accessedAt;

    // set from the service clock at issuance
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void setToken(String token) {
        this.token = token;
        this.tokenHash = token == null ? null : hashToken(token);
    }

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    /** Lower-case hex SHA-256 of the token. */
    public static String hashToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm unavailable", e);
        }
    }
}
