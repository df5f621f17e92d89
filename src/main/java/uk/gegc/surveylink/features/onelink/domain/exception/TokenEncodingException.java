package uk.gegc.surveylink.features.onelink.domain.exception;

public class TokenEncodingException extends RuntimeException {

    public TokenEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
