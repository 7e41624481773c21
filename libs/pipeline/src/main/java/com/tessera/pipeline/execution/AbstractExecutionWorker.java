package com.tessera.pipeline.execution;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.EventFactory;
import com.tessera.eventmodel.EventPhase;
import com.tessera.eventmodel.EventTypeName;
import com.tessera.eventmodel.payload.EventPayload;
import com.tessera.pipeline.dispatch.EventHandler;
import com.tessera.pipeline.dispatch.HandlerExecutionException;
import com.tessera.pipeline.notification.NotificationOutcome;
import com.tessera.pipeline.notification.RealtimeMessage;
import com.tessera.security.TenantMismatchException;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base of the workers that perform a subject's mutations once a command is validated.
 *
 * <p>A worker owns one subject and reacts to its {@code {subject}.*.validated} events. The
 * validated event id is the execution id: every step runs through a {@link StepContext} keyed by
 * it, so a redelivered event skips the steps that already completed. A failing execution is
 * retried per the {@link RetryPolicy}; once retries are exhausted, or on a {@link
 * NonRetryableExecutionException}, the failure is recorded in the {@link FailureLedger}, annotated
 * onto the validated event and never retried again.
 */
public abstract class AbstractExecutionWorker implements EventHandler {

    /** Metadata key carrying AI provenance, copied from the validated event to the completion. */
    public static final String AI_METADATA_KEY = "ai";

    public static final String FAILURE_METADATA_KEY = "executionFailure";

    private static final Logger log = LoggerFactory.getLogger(AbstractExecutionWorker.class);

    private final String subject;
    protected final ExecutionSupport support;

    protected AbstractExecutionWorker(String subject, ExecutionSupport support) {
        this.subject = subject;
        this.support = support;
    }

    /** Subject namespace this worker owns, e.g. "entities". */
    public String subject() {
        return subject;
    }

    /** Handler registration name. */
    public String name() {
        return subject + "-worker";
    }

    /** Pattern to register this worker under. */
    public String pattern() {
        return subject + ".*.validated";
    }

    /**
     * Runs one action. Implementations wrap every side effect in {@code steps.run}.
     *
     * @return short description of what was done
     * @throws NonRetryableExecutionException when retrying cannot help
     */
    protected abstract Object execute(String action, EventEnvelope event, StepContext steps)
            throws Exception;

    @Override
    public final Object handle(EventEnvelope event) {
        if (event.phase() != EventPhase.VALIDATED || !subject.equals(event.type().subject())) {
            return "ignored: " + event.type();
        }
        String executionId = event.id().toString();
        if (support.failures().find(executionId).isPresent()) {
            log.info("Execution {} already failed terminally; not retrying", executionId);
            return "skipped: terminal failure recorded";
        }

        RetryPolicy policy = support.retryPolicy();
        Timer.Sample sample = support.metrics().startSample();
        for (int attempt = 1; ; attempt++) {
            StepContext steps = new StepContext(executionId, support.steps());
            try {
                Object result = execute(event.type().action(), event, steps);
                sample.stop(timer(event, "success"));
                if (!steps.replayed().isEmpty()) {
                    log.info("Execution {} resumed, reused steps {}", executionId, steps.replayed());
                }
                return result;
            } catch (NonRetryableExecutionException | TenantMismatchException e) {
                sample.stop(timer(event, "failure"));
                throw giveUp(event, attempt, e);
            } catch (Exception e) {
                if (!policy.hasAttemptsLeft(attempt)) {
                    sample.stop(timer(event, "failure"));
                    throw giveUp(event, attempt, e);
                }
                Duration backoff = policy.backoffAfter(attempt);
                log.warn(
                        "Execution {} of {} failed on attempt {}/{}, retrying in {}ms: {}",
                        executionId,
                        event.type(),
                        attempt,
                        policy.maxAttempts(),
                        backoff.toMillis(),
                        e.toString());
                pause(event, attempt, backoff);
            }
        }
    }

    /**
     * Appends the {@code .completed} event for {@code event} as a memoized step. The completion id
     * is derived from the validated event's id, so deliveries racing past the step memo still
     * append and dispatch a single completion.
     *
     * @return id of the completion event
     */
    protected String emitCompletion(
            StepContext steps, String stepName, EventEnvelope event, String subjectId, EventPayload payload) {
        return steps.run(
                stepName,
                String.class,
                () -> {
                    EventTypeName completedType = event.type().withPhase(EventPhase.COMPLETED);
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    event.metadataValue(AI_METADATA_KEY).ifPresent(ai -> metadata.put(AI_METADATA_KEY, ai));
                    metadata.put("executionId", steps.executionId());
                    var completed =
                            support.factory()
                                    .derive(
                                            EventFactory.followUpId(event.id(), stepName),
                                            event,
                                            completedType,
                                            subjectId,
                                            payload,
                                            metadata);
                    if (support.publisher().publish(completed).appended()) {
                        log.info("Emitted {} {} for {}", completedType, completed.id(), subjectId);
                    } else {
                        log.info("{} {} for {} was already emitted", completedType, completed.id(), subjectId);
                    }
                    return completed.id().toString();
                });
    }

    /**
     * Best-effort push of an outcome. A failed push is logged and recorded as {@link
     * NotificationOutcome#FAILED}; it never fails the execution.
     */
    protected NotificationOutcome broadcast(
            StepContext steps, EventEnvelope event, Map<String, Object> data) {
        return steps.run(
                "broadcast-notification",
                NotificationOutcome.class,
                () -> {
                    String type = event.type().withPhase(EventPhase.COMPLETED).value();
                    var message = new RealtimeMessage(event.userId(), event.requestId(), type, data);
                    try {
                        return support.notifier().notify(message);
                    } catch (RuntimeException e) {
                        log.warn("Notification of {} for {} failed: {}", type, event.userId(), e.toString());
                        return NotificationOutcome.FAILED;
                    }
                });
    }

    protected static NonRetryableExecutionException unsupported(String action) {
        return new NonRetryableExecutionException("unsupported action: " + action);
    }

    private HandlerExecutionException giveUp(EventEnvelope event, int attempts, Exception cause) {
        var failure =
                new TerminalFailure(
                        event.id().toString(),
                        event.id(),
                        event.type().value(),
                        event.subjectId(),
                        event.userId(),
                        name(),
                        attempts,
                        cause.getClass().getName(),
                        cause.getMessage(),
                        support.clock().instant());
        support.failures().record(failure);
        var store = support.publisher().store();
        if (store.findById(event.id()).isPresent()) {
            store.annotate(event.id(), FAILURE_METADATA_KEY, failure.toMetadata());
        } else {
            log.warn("Validated event {} is not in the store; failure kept in the ledger only", event.id());
        }
        support.metrics()
                .counter(
                        "execution.terminal_failures",
                        "Executions that failed for good",
                        "worker", name(),
                        "command", event.type().command())
                .increment();
        log.error(
                "Execution {} of {} failed terminally after {} attempt(s)",
                event.id(),
                event.type(),
                attempts,
                cause);
        return new HandlerExecutionException(name(), cause.getMessage(), cause);
    }

    private void pause(EventEnvelope event, int attempt, Duration backoff) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw giveUp(event, attempt, e);
        }
    }

    private Timer timer(EventEnvelope event, String outcome) {
        return support.metrics()
                .timer(
                        "execution.duration",
                        "Time to execute a validated command",
                        "worker", name(),
                        "command", event.type().command(),
                        "outcome", outcome);
    }
}
