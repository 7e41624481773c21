package com.tessera.pipeline.execution;

import java.util.List;
import java.util.Optional;

/**
 * Memoized step results keyed by {@code (executionId, stepName)}. A redelivered execution reads
 * back the results of the steps that already completed instead of running them again.
 */
public interface StepResultStore {

    /**
     * A saved result. Wraps the value so a step that legitimately returned null is still
     * recognized as done.
     */
    record StepRecord(Object value) {}

    Optional<StepRecord> find(String executionId, String stepName);

    /** Saves a result; a result already saved for the same key is kept. */
    void save(String executionId, String stepName, Object value);

    /** Names of the completed steps of one execution, in completion order. */
    List<String> completedSteps(String executionId);
}
