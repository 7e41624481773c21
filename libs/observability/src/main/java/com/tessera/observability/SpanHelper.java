package com.tessera.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the current
 * {@link CorrelationContext}.
 *
 * <p>It does not configure the SDK. Without one, {@code OpenTelemetry.noop()} tracers make every
 * call here cheap and side-effect free.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** Runs {@code work} in an internal span. */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, Map.of(), work);
    }

    /**
     * Runs {@code work} in an internal span carrying {@code attributes}. An exception marks the span
     * as failed, is recorded on it and is rethrown unchanged.
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get()
                .ifPresent(
                        ctx -> {
                            span.setAttribute("tessera.correlation_id", ctx.correlationId());
                            setIfPresent(span, "tessera.causation_id", ctx.causationId());
                            setIfPresent(span, "tessera.event_id", ctx.eventId());
                            setIfPresent(span, "tessera.workspace_id", ctx.workspaceId());
                            setIfPresent(span, "enduser.id", ctx.userId());
                        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public void runInSpan(String spanName, Runnable work) {
        inSpan(
                spanName,
                Map.of(),
                () -> {
                    work.run();
                    return null;
                });
    }

    public Tracer tracer() {
        return tracer;
    }

    private static void setIfPresent(Span span, String key, String value) {
        if (value != null) {
            span.setAttribute(key, value);
        }
    }
}
