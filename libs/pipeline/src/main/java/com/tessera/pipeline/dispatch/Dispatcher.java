package com.tessera.pipeline.dispatch;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.observability.CorrelationContext;
import com.tessera.observability.CorrelationContextHolder;
import com.tessera.observability.MetricFactory;
import com.tessera.observability.SpanHelper;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans an event out to every handler whose pattern matches its type.
 *
 * <p>Each handler runs as its own task on the executor, inside its own span and with the event's
 * correlation identifiers in MDC. A handler that throws is recorded as a failed outcome and
 * counted; the others still run and nothing is rethrown to the caller.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final HandlerRegistry registry;
    private final Executor executor;
    private final MetricFactory metrics;
    private final SpanHelper spans;

    public Dispatcher(
            HandlerRegistry registry, Executor executor, MetricFactory metrics, SpanHelper spans) {
        this.registry = registry;
        this.executor = executor;
        this.metrics = metrics;
        this.spans = spans;
    }

    /** Dispatches and waits for every handler to finish. */
    public DispatchSummary dispatch(EventEnvelope event) {
        return dispatchAsync(event).join();
    }

    /**
     * Dispatches without waiting. The returned future always completes normally, since handler
     * failures are part of the summary.
     */
    public CompletableFuture<DispatchSummary> dispatchAsync(EventEnvelope event) {
        var matching = registry.handlersFor(event.type());
        if (matching.isEmpty()) {
            log.debug("No handlers for {} {}", event.type(), event.id());
            return CompletableFuture.completedFuture(
                    DispatchSummary.of(event.id(), event.type().value(), List.of()));
        }

        List<CompletableFuture<HandlerOutcome>> futures = new ArrayList<>(matching.size());
        for (HandlerRegistry.Registration registration : matching) {
            futures.add(runIsolated(registration, event));
        }

        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .thenApply(
                        ignored -> {
                            var outcomes = futures.stream().map(CompletableFuture::join).toList();
                            var summary =
                                    DispatchSummary.of(event.id(), event.type().value(), outcomes);
                            if (summary.failed() > 0) {
                                log.warn(
                                        "Dispatched {} {}: {} succeeded, {} failed",
                                        event.type(),
                                        event.id(),
                                        summary.successful(),
                                        summary.failed());
                            } else {
                                log.debug(
                                        "Dispatched {} {} to {} handler(s)",
                                        event.type(),
                                        event.id(),
                                        summary.handlerCount());
                            }
                            return summary;
                        });
    }

    private CompletableFuture<HandlerOutcome> runIsolated(
            HandlerRegistry.Registration registration, EventEnvelope event) {
        try {
            return CompletableFuture.supplyAsync(() -> run(registration, event), executor)
                    .exceptionally(e -> failed(registration.name(), event, unwrap(e), Duration.ZERO));
        } catch (RuntimeException rejected) {
            // executor refused the task (shut down or saturated)
            return CompletableFuture.completedFuture(
                    failed(registration.name(), event, rejected, Duration.ZERO));
        }
    }

    private HandlerOutcome run(HandlerRegistry.Registration registration, EventEnvelope event) {
        String name = registration.name();
        var context =
                new CorrelationContext(
                        event.correlationId(),
                        event.causationId(),
                        event.userId(),
                        null,
                        event.requestId(),
                        event.id().toString());
        Timer.Sample sample = metrics.startSample();
        long started = System.nanoTime();
        return CorrelationContextHolder.callWithContext(
                context,
                () -> {
                    try {
                        Object result =
                                spans.inSpan(
                                        "handle " + name,
                                        Map.of(
                                                "tessera.handler", name,
                                                "tessera.event_type", event.type().value()),
                                        () -> invoke(registration, event));
                        sample.stop(timer(name, "success"));
                        return HandlerOutcome.success(name, result, elapsed(started));
                    } catch (RuntimeException e) {
                        sample.stop(timer(name, "failure"));
                        return failed(name, event, unwrap(e), elapsed(started));
                    }
                });
    }

    private static Object invoke(HandlerRegistry.Registration registration, EventEnvelope event) {
        try {
            return registration.handler().handle(event);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new HandlerExecutionException(registration.name(), e.getMessage(), e);
        }
    }

    private HandlerOutcome failed(String name, EventEnvelope event, Throwable error, Duration duration) {
        metrics.counter(
                        "dispatch.handler.failures",
                        "Handler runs that threw",
                        "handler", name)
                .increment();
        log.warn("Handler {} failed on {} {}: {}", name, event.type(), event.id(), error.toString());
        return HandlerOutcome.failure(name, error, duration);
    }

    private Timer timer(String handler, String outcome) {
        return metrics.timer(
                "dispatch.handler.duration",
                "Time spent in one handler run",
                "handler", handler,
                "outcome", outcome);
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static Throwable unwrap(Throwable e) {
        if (e instanceof CompletionException && e.getCause() != null) {
            return e.getCause();
        }
        if (e instanceof HandlerExecutionException && e.getCause() != null && e.getMessage() == null) {
            return e.getCause();
        }
        return e;
    }
}
