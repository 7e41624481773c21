package com.tessera.pipeline.storage;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTaskDetailsRepository implements TaskDetailsRepository {

    private final Map<String, TaskDetails> rows = new ConcurrentHashMap<>();

    @Override
    public TaskDetails insertIfAbsent(TaskDetails details) {
        TaskDetails existing = rows.putIfAbsent(details.entityId(), details);
        return existing != null ? existing : details;
    }

    @Override
    public Optional<TaskDetails> findByEntityId(String entityId) {
        return Optional.ofNullable(rows.get(entityId));
    }

    public int count() {
        return rows.size();
    }
}
