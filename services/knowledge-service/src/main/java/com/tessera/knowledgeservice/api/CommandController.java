package com.tessera.knowledgeservice.api;

import com.tessera.eventmodel.EventInput;
import com.tessera.eventmodel.EventSource;
import com.tessera.eventmodel.EventTypeName;
import com.tessera.knowledgeservice.infrastructure.web.RequestHeaders;
import com.tessera.observability.CorrelationContext;
import com.tessera.observability.CorrelationContextHolder;
import com.tessera.pipeline.publish.CommandSubmitter;
import com.tessera.pipeline.publish.SubmissionReceipt;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * The command submission contract: a {@code .requested} event goes in, {@code 202} with its id
 * comes back. The outcome (validated, pending, denied, completed) is observed through the event
 * endpoints or real-time notifications.
 */
@RestController
@RequestMapping("/api/v1/commands")
public class CommandController {

    private final CommandSubmitter submitter;

    public CommandController(CommandSubmitter submitter) {
        this.submitter = submitter;
    }

    /**
     * @param type full event type, e.g. {@code entities.create.requested}
     * @param subjectId target aggregate, generated when absent
     * @param source originator, {@code user} when absent; {@code system} is reserved
     * @param requestId client request id used to route real-time notifications
     */
    public record CommandRequest(
            @NotBlank String type,
            String subjectId,
            String subjectType,
            Map<String, Object> data,
            String source,
            String requestId) {}

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SubmissionReceipt submit(
            @RequestHeader(RequestHeaders.USER_ID) String userId, @Valid @RequestBody CommandRequest request) {
        EventTypeName type =
                EventTypeName.tryParse(request.type())
                        .orElseThrow(
                                () -> new IllegalArgumentException("Malformed event type: " + request.type()));
        EventSource source = parseSource(request.source());

        EventInput input =
                EventInput.of(type, userId, request.data() == null ? Map.of() : request.data())
                        .withSubject(request.subjectId(), request.subjectType())
                        .withSource(source)
                        .withCorrelation(currentCorrelationId(), null)
                        .withRequestId(
                                request.requestId() != null
                                        ? request.requestId()
                                        : CorrelationContextHolder.get().map(CorrelationContext::requestId).orElse(null));
        return submitter.submit(input);
    }

    static EventSource parseSource(String value) {
        if (value == null || value.isBlank()) {
            return EventSource.USER;
        }
        EventSource source =
                EventSource.fromString(value)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + value));
        if (source == EventSource.SYSTEM) {
            throw new IllegalArgumentException("Source 'system' is reserved for pipeline events");
        }
        return source;
    }

    static String currentCorrelationId() {
        return CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null);
    }
}
