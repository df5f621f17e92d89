package uk.gegc.surveylink.features.onelink.application;

/**
 * Closed set of expected failures of link issuance, preview and consumption.
 */
public enum LinkErrorKind {

    /** Malformed, unauthenticated or never issued. Permanent. */
    INVALID_TOKEN(false),
    /** Past its expiry. Permanent. */
    TOKEN_EXPIRED(false),
    /** Already consumed. Permanent. */
    LINK_ALREADY_USED(false),
    /** Another request holds the consumption lock for this token. The caller may retry. */
    CONCURRENT_SUBMISSION(true),
    INVALID_PREFILL_KEY(false),
    /** Serialized prefill does not fit the link record. */
    PREFILL_TOO_LARGE(false),
    EXPIRY_OUT_OF_RANGE(false),
    /** Payload could not be sealed. Internal fault. */
    ENCODING_ERROR(false);

    private final boolean retryable;

    LinkErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
