package uk.gegc.surveylink.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.Instant;
import java.util.Map;

/**
 * Fluent builder for the RFC 7807 bodies returned by this service.
 *
 * <p>Every problem carries a machine-readable {@code code} and a {@code retryable} flag next to the
 * standard members, so a link holder can tell "expired" from "already used" from "try again" without
 * parsing titles. Custom properties are applied before {@code code} and {@code retryable}, which
 * therefore cannot be overwritten by error details.
 */
public final class ProblemDetailBuilder {

    private final HttpStatus status;
    private final ProblemDetail problem;
    private final String code;
    private boolean retryable;

    private ProblemDetailBuilder(HttpStatus status, URI type, String title, String code) {
        this.status = status;
        this.problem = ProblemDetail.forStatus(status);
        this.problem.setType(type);
        this.problem.setTitle(title);
        this.code = code;
    }

    /**
     * @param code stable identifier clients switch on, e.g. {@code LINK_ALREADY_USED}
     */
    public static ProblemDetailBuilder problem(HttpStatus status, URI type, String title, String code) {
        return new ProblemDetailBuilder(status, type, title, code);
    }

    public ProblemDetailBuilder detail(String detail) {
        problem.setDetail(detail);
        return this;
    }

    public ProblemDetailBuilder retryable(boolean retryable) {
        this.retryable = retryable;
        return this;
    }

    public ProblemDetailBuilder property(String name, Object value) {
        problem.setProperty(name, value);
        return this;
    }

    public ProblemDetailBuilder properties(Map<String, ?> properties) {
        if (properties != null) {
            properties.forEach(problem::setProperty);
        }
        return this;
    }

    public ProblemDetailBuilder instance(HttpServletRequest request) {
        if (request != null) {
            problem.setInstance(URI.create(request.getRequestURI()));
        }
        return this;
    }

    /** Spring MVC override hooks only hand out a {@link WebRequest}; its description is {@code uri=/path}. */
    public ProblemDetailBuilder instance(WebRequest request) {
        if (request != null) {
            String description = request.getDescription(false);
            if (description != null) {
                problem.setInstance(URI.create(description.startsWith("uri=") ? description.substring(4) : description));
            }
        }
        return this;
    }

    public ProblemDetail build() {
        problem.setProperty("code", code);
        problem.setProperty("retryable", retryable);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    public ResponseEntity<ProblemDetail> toResponse() {
        return ResponseEntity.status(status).body(build());
    }
}
