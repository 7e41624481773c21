package com.tessera.knowledgeservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.tessera.eventmodel.SchemaValidationException;
import com.tessera.eventstore.ConcurrencyConflictException;
import com.tessera.eventstore.UnknownEventException;
import com.tessera.observability.CorrelationContext;
import com.tessera.observability.CorrelationContextHolder;
import com.tessera.pipeline.governor.NotAnApproverException;
import com.tessera.threads.StreamFailedException;
import com.tessera.threads.ThreadConflictException;
import com.tessera.threads.UnknownThreadException;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

/** Exception mapping as a plain unit, no Spring context. */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps a schema violation to 400 with the individual errors")
    void schemaViolation() {
        ProblemDetail result =
                handler.handleSchema(
                        new SchemaValidationException(
                                "entities.create.requested", List.of("entityType must not be blank")));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getTitle()).isEqualTo("Schema Violation");
        assertThat(result.getType().toString()).isEqualTo("https://tessera.dev/errors/schema");
        assertThat(result.getProperties())
                .containsEntry("errors", List.of("entityType must not be blank"));
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void illegalArgument() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps credential failures to 401 and foreign resources to 403")
    void authFailures() {
        assertThat(handler.handleUnauthorized(new UnauthorizedException("no")).getStatus()).isEqualTo(401);
        assertThat(handler.handleForbidden(new ForbiddenException("mine")).getStatus()).isEqualTo(403);
        assertThat(
                        handler.handleForbidden(new NotAnApproverException(UUID.randomUUID(), "mallory"))
                                .getStatus())
                .isEqualTo(403);
    }

    @Test
    @DisplayName("maps unknown events and threads to 404")
    void notFound() {
        assertThat(handler.handleNotFound(new UnknownEventException(UUID.randomUUID())).getStatus())
                .isEqualTo(404);
        assertThat(handler.handleNotFound(new UnknownThreadException("t-1")).getStatus()).isEqualTo(404);
    }

    @Test
    @DisplayName("maps conflicts to 409")
    void conflicts() {
        assertThat(handler.handleConflict(new ConcurrencyConflictException("s-1", 3, 4)).getStatus())
                .isEqualTo(409);
        assertThat(handler.handleConflict(new ThreadConflictException("archived")).getStatus())
                .isEqualTo(409);
        assertThat(handler.handleConflict(new IllegalStateException("decided")).getStatus())
                .isEqualTo(409);
    }

    @Test
    @DisplayName("maps a failed stream to 502")
    void streamFailed() {
        assertThat(handler.handleStreamFailed(new StreamFailedException("stalled")).getStatus())
                .isEqualTo(502);
    }

    @Test
    @DisplayName("hides internal details behind 500")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("db password is hunter2"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).doesNotContain("hunter2");
    }

    @Test
    @DisplayName("error responses carry a timestamp and the current correlation id")
    void timestampAndCorrelation() {
        CorrelationContextHolder.set(CorrelationContext.of("corr-42"));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-42");
    }
}
