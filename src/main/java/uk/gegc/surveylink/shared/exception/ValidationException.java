package uk.gegc.surveylink.shared.exception;

/**
 * Request content is well-formed but violates a business rule. Maps to HTTP 400.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
