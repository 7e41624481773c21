package com.tessera.eventmodel.payload;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Data of {@code entities.update.*}.
 *
 * @param entityId entity to update; required
 * @param title new title, unchanged when null
 * @param preview new preview, unchanged when null
 * @param content new body, rewritten to the object store when present
 * @param metadata properties to merge into the entity
 * @param expectedVersion version the caller read; the update is rejected when the row moved on
 * @param workspaceId owning workspace, null for personal entities
 * @param projectIds projects the entity belongs to
 */
public record EntityUpdatePayload(
        String entityId,
        String title,
        String preview,
        String content,
        Map<String, Object> metadata,
        Long expectedVersion,
        String workspaceId,
        List<String> projectIds)
        implements CommandPayload {

    public EntityUpdatePayload {
        metadata = PayloadChecks.copyOrEmpty(metadata);
        projectIds = PayloadChecks.copyOrEmpty(projectIds);
    }

    @Override
    public String resourceId() {
        return entityId;
    }

    @Override
    public List<String> violations() {
        var errors = new ArrayList<String>();
        PayloadChecks.requireUuid(errors, "entityId", entityId);
        PayloadChecks.optionalPositive(errors, "expectedVersion", expectedVersion);
        return errors;
    }
}
