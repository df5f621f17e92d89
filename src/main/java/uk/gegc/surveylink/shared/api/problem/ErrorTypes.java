package uk.gegc.surveylink.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://surveylink.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== One-Time Link Errors ====================
    public static final URI INVALID_TOKEN = URI.create(BASE_URL + "/invalid-token");
    public static final URI TOKEN_EXPIRED = URI.create(BASE_URL + "/token-expired");
    public static final URI LINK_ALREADY_USED = URI.create(BASE_URL + "/link-already-used");
    public static final URI CONCURRENT_SUBMISSION = URI.create(BASE_URL + "/concurrent-submission");
    public static final URI INVALID_PREFILL_KEY = URI.create(BASE_URL + "/invalid-prefill-key");
    public static final URI PREFILL_TOO_LARGE = URI.create(BASE_URL + "/prefill-too-large");
    public static final URI EXPIRY_OUT_OF_RANGE = URI.create(BASE_URL + "/expiry-out-of-range");
    public static final URI TOKEN_ENCODING_FAILED = URI.create(BASE_URL + "/token-encoding-failed");

    // ==================== State Errors ====================
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
