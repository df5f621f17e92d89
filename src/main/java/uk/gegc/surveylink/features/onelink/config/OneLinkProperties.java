package uk.gegc.surveylink.features.onelink.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for one-time survey links.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "surveylink.one-link")
public class OneLinkProperties {

    /**
     * Public origin used to build access URLs, without trailing slash.
     */
    private String baseUrl = "http://localhost:3000";

    /**
     * 256-bit AES key, Base64 encoded or given as a raw 32-byte string.
     */
    private String encryptionKey;

    private Duration defaultExpiry = Duration.ofDays(7);

    private Duration maxExpiry = Duration.ofDays(30);

    /**
     * Lease of the per-token consumption lock. Not renewed, so it must exceed the slowest submission.
     */
    private Duration lockLease = Duration.ofSeconds(10);

    private String cleanupCron = "0 0 * * * *";
}
