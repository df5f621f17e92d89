package uk.gegc.surveylink.features.onelink.domain.exception;

/**
 * A token could not be decoded or authenticated: bad text encoding, truncated blob,
 * wrong key or tampered bytes.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
