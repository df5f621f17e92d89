package uk.gegc.surveylink.features.onelink.application;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Outcome of a link operation: either a value or a {@link LinkError}. Expected rejections travel
 * in this type; only infrastructure faults are thrown.
 */
public final class LinkResult<T> {

    private final T value;
    private final LinkError error;

    private LinkResult(T value, LinkError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> LinkResult<T> success(T value) {
        return new LinkResult<>(value, null);
    }

    public static <T> LinkResult<T> failure(LinkError error) {
        return new LinkResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> LinkResult<T> failure(LinkErrorKind kind, String message) {
        return failure(LinkError.of(kind, message));
    }

    public static <T> LinkResult<T> failure(LinkErrorKind kind, String message, Map<String, Object> details) {
        return failure(new LinkError(kind, message, details));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T value() {
        if (error != null) {
            throw new NoSuchElementException("No value present, link operation failed with " + error.kind());
        }
        return value;
    }

    public LinkError error() {
        if (error == null) {
            throw new NoSuchElementException("No error present, link operation succeeded");
        }
        return error;
    }

    /**
     * @return the error kind, or null on success
     */
    public LinkErrorKind errorKind() {
        return error == null ? null : error.kind();
    }

    @Override
    public String toString() {
        return error == null ? "LinkResult[success=" + value + "]" : "LinkResult[failure=" + error + "]";
    }
}
