package com.tessera.knowledgeservice.infrastructure.web;

import com.tessera.eventmodel.SchemaValidationException;
import com.tessera.eventstore.ConcurrencyConflictException;
import com.tessera.eventstore.UnknownEventException;
import com.tessera.observability.CorrelationContextHolder;
import com.tessera.pipeline.governor.NotAnApproverException;
import com.tessera.threads.StreamFailedException;
import com.tessera.threads.ThreadConflictException;
import com.tessera.threads.UnknownThreadException;
import java.net.URI;
import java.time.Instant;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses carrying a timestamp and the
 * request's correlation id.
 *
 * <pre>
 * {
 *   "type": "https://tessera.dev/errors/schema",
 *   "title": "Schema Violation",
 *   "status": 400,
 *   "detail": "entities.create.requested: entityType must not be blank",
 *   "errors": ["entityType must not be blank"],
 *   "timestamp": "2026-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String TYPE_BASE = "https://tessera.dev/errors/";

    @ExceptionHandler(SchemaValidationException.class)
    public ProblemDetail handleSchema(SchemaValidationException ex) {
        log.warn("Rejected {}: {}", ex.eventType(), ex.errors());
        ProblemDetail problem =
                problem(HttpStatus.BAD_REQUEST, "Schema Violation", "schema", ex.getMessage());
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(
                HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Request body is not valid JSON");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Malformed parameter {}: {}", ex.getName(), ex.getValue());
        return problem(
                HttpStatus.BAD_REQUEST,
                "Bad Request",
                "bad-request",
                "Malformed value for '" + ex.getName() + "'");
    }

    @ExceptionHandler({UnauthorizedException.class, MissingRequestHeaderException.class})
    public ProblemDetail handleUnauthorized(Exception ex) {
        log.warn("Unauthorized: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", ex.getMessage());
    }

    @ExceptionHandler({ForbiddenException.class, NotAnApproverException.class})
    public ProblemDetail handleForbidden(RuntimeException ex) {
        log.warn("Forbidden: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", ex.getMessage());
    }

    @ExceptionHandler({
        UnknownEventException.class,
        UnknownThreadException.class,
        NoSuchElementException.class
    })
    public ProblemDetail handleNotFound(RuntimeException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler({
        ConcurrencyConflictException.class,
        ThreadConflictException.class,
        IllegalStateException.class
    })
    public ProblemDetail handleConflict(RuntimeException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "conflict", ex.getMessage());
    }

    @ExceptionHandler(StreamFailedException.class)
    public ProblemDetail handleStreamFailed(StreamFailedException ex) {
        log.warn("Streaming failed: {}", ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "Stream Failed", "stream-failed", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(
            HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
