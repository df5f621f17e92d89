package uk.gegc.surveylink.features.onelink.api;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import uk.gegc.surveylink.features.onelink.application.LinkError;
import uk.gegc.surveylink.features.onelink.application.LinkErrorKind;
import uk.gegc.surveylink.shared.api.problem.ErrorTypes;
import uk.gegc.surveylink.shared.api.problem.ProblemDetailBuilder;

/**
 * Maps link error kinds to HTTP problems. Every kind has its own type URI, and the kind name is
 * the problem {@code code}.
 */
public final class LinkProblemMapper {

    private LinkProblemMapper() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static HttpStatus statusOf(LinkErrorKind kind) {
        return switch (kind) {
            case INVALID_TOKEN, INVALID_PREFILL_KEY, PREFILL_TOO_LARGE, EXPIRY_OUT_OF_RANGE -> HttpStatus.BAD_REQUEST;
            case TOKEN_EXPIRED, LINK_ALREADY_USED -> HttpStatus.GONE;
            case CONCURRENT_SUBMISSION -> HttpStatus.CONFLICT;
            case ENCODING_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public static ResponseEntity<ProblemDetail> toResponse(LinkError error, HttpServletRequest request) {
        return builderFor(error.kind())
                .detail(error.message())
                .properties(error.details())
                .instance(request)
                .toResponse();
    }

    private static ProblemDetailBuilder builderFor(LinkErrorKind kind) {
        HttpStatus status = statusOf(kind);
        ProblemDetailBuilder builder = switch (kind) {
            case INVALID_TOKEN -> ProblemDetailBuilder.problem(status, ErrorTypes.INVALID_TOKEN,
                    "Invalid Token", kind.name());
            case TOKEN_EXPIRED -> ProblemDetailBuilder.problem(status, ErrorTypes.TOKEN_EXPIRED,
                    "Link Expired", kind.name());
            case LINK_ALREADY_USED -> ProblemDetailBuilder.problem(status, ErrorTypes.LINK_ALREADY_USED,
                    "Link Already Used", kind.name());
            case CONCURRENT_SUBMISSION -> ProblemDetailBuilder.problem(status, ErrorTypes.CONCURRENT_SUBMISSION,
                    "Submission In Progress", kind.name());
            case INVALID_PREFILL_KEY -> ProblemDetailBuilder.problem(status, ErrorTypes.INVALID_PREFILL_KEY,
                    "Invalid Prefill Key", kind.name());
            case PREFILL_TOO_LARGE -> ProblemDetailBuilder.problem(status, ErrorTypes.PREFILL_TOO_LARGE,
                    "Prefill Too Large", kind.name());
            case EXPIRY_OUT_OF_RANGE -> ProblemDetailBuilder.problem(status, ErrorTypes.EXPIRY_OUT_OF_RANGE,
                    "Expiry Out Of Range", kind.name());
            case ENCODING_ERROR -> ProblemDetailBuilder.problem(status, ErrorTypes.TOKEN_ENCODING_FAILED,
                    "Token Encoding Failed", kind.name());
        };
        return builder.retryable(kind.isRetryable());
    }
}
