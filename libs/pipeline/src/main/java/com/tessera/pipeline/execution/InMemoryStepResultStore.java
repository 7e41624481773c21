package com.tessera.pipeline.execution;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryStepResultStore implements StepResultStore {

    private record Key(String executionId, String stepName) {}

    private final Map<Key, StepRecord> results = new ConcurrentHashMap<>();
    private final Map<String, List<String>> order = new ConcurrentHashMap<>();

    @Override
    public Optional<StepRecord> find(String executionId, String stepName) {
        return Optional.ofNullable(results.get(new Key(executionId, stepName)));
    }

    @Override
    public void save(String executionId, String stepName, Object value) {
        if (results.putIfAbsent(new Key(executionId, stepName), new StepRecord(value)) == null) {
            order.computeIfAbsent(executionId, id -> new CopyOnWriteArrayList<>()).add(stepName);
        }
    }

    @Override
    public List<String> completedSteps(String executionId) {
        return List.copyOf(order.getOrDefault(executionId, List.of()));
    }
}
