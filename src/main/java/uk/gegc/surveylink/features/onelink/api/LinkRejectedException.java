package uk.gegc.surveylink.features.onelink.api;

import uk.gegc.surveylink.features.onelink.application.LinkError;
import uk.gegc.surveylink.features.onelink.application.LinkResult;

/**
 * Carries a rejected {@link LinkResult} from a controller to the exception handler.
 */
public class LinkRejectedException extends RuntimeException {

    private final transient LinkError error;

    public LinkRejectedException(LinkError error) {
        super(error.message());
        this.error = error;
    }

    public LinkError getError() {
        return error;
    }

    public static <T> T unwrap(LinkResult<T> result) {
        if (result.isFailure()) {
            throw new LinkRejectedException(result.error());
        }
        return result.value();
    }
}
