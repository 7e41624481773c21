package com.tessera.pipeline.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the named steps of one execution, each at most once to completion.
 *
 * <p>A step whose result is already in the {@link StepResultStore} is not run; its saved result is
 * returned. A step that throws saves nothing, so the next attempt runs it again.
 */
public final class StepContext {

    private static final Logger log = LoggerFactory.getLogger(StepContext.class);

    private final String executionId;
    private final StepResultStore store;
    private final List<String> replayed = new ArrayList<>();
    private final List<String> executed = new ArrayList<>();

    public StepContext(String executionId, StepResultStore store) {
        this.executionId = executionId;
        this.store = store;
    }

    /**
     * Runs {@code step} unless it already completed for this execution.
     *
     * @param type the step's result type; a saved result of another type fails the step
     * @throws IllegalStateException when the saved result is not a {@code type}
     */
    public <T> T run(String stepName, Class<T> type, Supplier<T> step) {
        Optional<StepResultStore.StepRecord> saved = store.find(executionId, stepName);
        if (saved.isPresent()) {
            log.debug("Step {} of {} already completed, reusing its result", stepName, executionId);
            Object value = saved.get().value();
            if (value != null && !type.isInstance(value)) {
                throw new IllegalStateException(
                        "Step " + stepName + " of " + executionId + " saved a "
                                + value.getClass().getName() + ", not a " + type.getName());
            }
            replayed.add(stepName);
            return type.cast(value);
        }
        T result = step.get();
        store.save(executionId, stepName, result);
        executed.add(stepName);
        return result;
    }

    public String executionId() {
        return executionId;
    }

    /** Steps answered from the store during this context's lifetime. */
    public List<String> replayed() {
        return List.copyOf(replayed);
    }

    /** Steps actually run during this context's lifetime. */
    public List<String> executed() {
        return List.copyOf(executed);
    }
}
