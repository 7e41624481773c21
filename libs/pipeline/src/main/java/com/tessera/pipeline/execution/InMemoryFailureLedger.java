package com.tessera.pipeline.execution;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryFailureLedger implements FailureLedger {

    private final Map<String, TerminalFailure> failures = new ConcurrentHashMap<>();

    @Override
    public void record(TerminalFailure failure) {
        failures.putIfAbsent(failure.executionId(), failure);
    }

    @Override
    public Optional<TerminalFailure> find(String executionId) {
        return Optional.ofNullable(failures.get(executionId));
    }

    @Override
    public List<TerminalFailure> all() {
        return failures.values().stream()
                .sorted(Comparator.comparing(TerminalFailure::failedAt))
                .toList();
    }
}
