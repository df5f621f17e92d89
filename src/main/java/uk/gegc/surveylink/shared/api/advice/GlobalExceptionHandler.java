package uk.gegc.surveylink.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.surveylink.features.onelink.api.LinkProblemMapper;
import uk.gegc.surveylink.features.onelink.api.LinkRejectedException;
import uk.gegc.surveylink.features.onelink.application.LinkError;
import uk.gegc.surveylink.shared.api.problem.ErrorTypes;
import uk.gegc.surveylink.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.surveylink.shared.exception.ResourceNotFoundException;
import uk.gegc.surveylink.shared.exception.ValidationException;

import java.net.URI;
import java.util.List;

/**
 * Renders every failure as a problem body with a {@code code}. Link rejections keep their own codes,
 * bean validation failures from bodies and from parameters share the {@code fieldErrors} shape.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(LinkRejectedException.class)
    public ResponseEntity<ProblemDetail> handleLinkRejected(LinkRejectedException ex, HttpServletRequest request) {
        LinkError error = ex.getError();
        if (LinkProblemMapper.statusOf(error.kind()).is5xxServerError()) {
            log.error("Link operation on {} failed: {}", request.getRequestURI(), error.message());
        } else {
            log.debug("Link operation on {} rejected with {}", request.getRequestURI(), error.kind());
        }
        return LinkProblemMapper.toResponse(error, request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return ProblemDetailBuilder.problem(HttpStatus.NOT_FOUND, ErrorTypes.RESOURCE_NOT_FOUND,
                        "Resource Not Found", "RESOURCE_NOT_FOUND")
                .detail(ex.getMessage())
                .instance(request)
                .toResponse();
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        return badRequest(ErrorTypes.VALIDATION_FAILED, "Validation Failed", "VALIDATION_FAILED")
                .detail(ex.getMessage())
                .instance(request)
                .toResponse();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return badRequest(ErrorTypes.INVALID_ARGUMENT, "Invalid Argument", "INVALID_ARGUMENT")
                .detail(ex.getMessage())
                .instance(request)
                .toResponse();
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String expectedType = ex.getRequiredType() == null ? "unknown" : ex.getRequiredType().getSimpleName();
        return badRequest(ErrorTypes.TYPE_MISMATCH, "Type Mismatch", "TYPE_MISMATCH")
                .detail("Parameter '" + ex.getName() + "' must be of type " + expectedType)
                .property("parameter", ex.getName())
                .property("expectedType", expectedType)
                .instance(request)
                .toResponse();
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        List<FieldValidationError> fieldErrors = ex.getConstraintViolations().stream()
                .map(v -> new FieldValidationError(v.getPropertyPath().toString(), v.getMessage(), v.getInvalidValue()))
                .toList();
        return badRequest(ErrorTypes.VALIDATION_FAILED, "Validation Failed", "VALIDATION_FAILED")
                .detail("One or more request parameters are invalid")
                .property("fieldErrors", fieldErrors)
                .instance(request)
                .toResponse();
    }

    // the store rejected a write the service let through
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleDataIntegrity(DataIntegrityViolationException ex, HttpServletRequest request) {
        log.error("Data integrity violation on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage(), ex);
        return ProblemDetailBuilder.problem(HttpStatus.CONFLICT, ErrorTypes.DATA_CONFLICT, "Data Conflict", "DATA_CONFLICT")
                .detail("The request conflicts with stored data")
                .instance(request)
                .toResponse();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {}", request.getRequestURI(), ex);
        return ProblemDetailBuilder.problem(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.INTERNAL_SERVER_ERROR,
                        "Internal Server Error", "INTERNAL_ERROR")
                .detail("An unexpected error occurred")
                .instance(request)
                .toResponse();
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        ProblemDetail problem = badRequest(ErrorTypes.MALFORMED_JSON, "Malformed JSON", "MALFORMED_JSON")
                .detail("Request body is malformed or cannot be read")
                .property("parseError", ex.getMostSpecificCause().getMessage())
                .instance(request)
                .build();
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        List<FieldValidationError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> new FieldValidationError(e.getField(), e.getDefaultMessage(), e.getRejectedValue()))
                .toList();
        ProblemDetail problem = badRequest(ErrorTypes.VALIDATION_FAILED, "Validation Failed", "VALIDATION_FAILED")
                .detail("Validation failed for one or more fields")
                .property("fieldErrors", fieldErrors)
                .instance(request)
                .build();
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    private static ProblemDetailBuilder badRequest(URI type, String title, String code) {
        return ProblemDetailBuilder.problem(HttpStatus.BAD_REQUEST, type, title, code);
    }

    private record FieldValidationError(String field, String message, Object rejectedValue) {
    }
}
