package com.tessera.pipeline.storage;

import java.util.Optional;

public interface TaskDetailsRepository {

    /** Inserts unless the entity already has task details; returns the stored row. */
    TaskDetails insertIfAbsent(TaskDetails details);

    Optional<TaskDetails> findByEntityId(String entityId);
}
