package com.tessera.observability;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 *
 * <p>Handlers run on pooled threads, so the dispatcher hands the context over explicitly with
 * {@link #callWithContext(CorrelationContext, Supplier)}; the previous context is restored
 * afterwards so a pooled thread never leaks one run's identifiers into the next.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private static final String[] MDC_KEYS = {
        CorrelationContext.MDC_CORRELATION_ID,
        CorrelationContext.MDC_CAUSATION_ID,
        CorrelationContext.MDC_USER_ID,
        CorrelationContext.MDC_WORKSPACE_ID,
        CorrelationContext.MDC_REQUEST_ID,
        CorrelationContext.MDC_EVENT_ID
    };

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        setMdc(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        setMdc(CorrelationContext.MDC_CAUSATION_ID, context.causationId());
        setMdc(CorrelationContext.MDC_USER_ID, context.userId());
        setMdc(CorrelationContext.MDC_WORKSPACE_ID, context.workspaceId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, context.requestId());
        setMdc(CorrelationContext.MDC_EVENT_ID, context.eventId());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Clears the context and removes every MDC key it set. */
    public static void clear() {
        CONTEXT.remove();
        for (String key : MDC_KEYS) {
            MDC.remove(key);
        }
    }

    /** Runs {@code work} with {@code context} set, then restores whatever was there before. */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    public static void runWithContext(CorrelationContext context, Runnable work) {
        callWithContext(
                context,
                () -> {
                    work.run();
                    return null;
                });
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
