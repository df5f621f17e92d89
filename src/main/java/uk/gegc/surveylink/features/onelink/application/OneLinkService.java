package uk.gegc.surveylink.features.onelink.application;

import java.time.Instant;
import java.util.Map;

public interface OneLinkService {

    /**
     * Issues a new one-time link for a survey.
     *
     * @param expiresAt explicit expiry, or null for the configured default horizon
     */
    LinkResult<IssuedLink> issueLink(Long surveyId, Map<String, Object> prefill, Instant expiresAt);

    /**
     * Validates a token for read-only access. Records the first access but never consumes the link.
     */
    LinkResult<LinkPreview> previewLink(String token);

    /**
     * Validates and consumes a token exactly once. {@code action} runs only when the link is confirmed
     * unused, at most once per token, and its result is returned on success.
     */
    <T> LinkResult<T> consumeLink(String token, LinkAction<T> action);
}
