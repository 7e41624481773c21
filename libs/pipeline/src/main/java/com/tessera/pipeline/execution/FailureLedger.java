package com.tessera.pipeline.execution;

import java.util.List;
import java.util.Optional;

/** Audit record of executions that failed for good. Operators read it; nothing retries from it. */
public interface FailureLedger {

    /** Records a failure; a second record for the same execution is ignored. */
    void record(TerminalFailure failure);

    Optional<TerminalFailure> find(String executionId);

    List<TerminalFailure> all();
}
