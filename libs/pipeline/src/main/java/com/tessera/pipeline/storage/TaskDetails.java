package com.tessera.pipeline.storage;

import java.time.Instant;

/**
 * Task-specific extension row of an entity whose type is {@code task}.
 *
 * @param entityId owning entity
 * @param status workflow status, {@code todo} unless given
 * @param priority priority label, may be null
 * @param dueDate due date, may be null
 */
public record TaskDetails(String entityId, String status, String priority, Instant dueDate) {

    public TaskDetails {
        if (status == null || status.isBlank()) {
            status = "todo";
        }
    }
}
