package com.tessera.eventmodel.payload;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Data of {@code entities.create.*}.
 *
 * @param entityType kind of entity, e.g. "note", "task", "project"; required
 * @param id caller-chosen entity id (UUID); the worker derives a deterministic one when absent
 * @param title display title
 * @param preview short preview text
 * @param content inline markdown body, stored in the object store
 * @param file uploaded file, stored in the object store
 * @param tags tag names
 * @param metadata type-specific properties (e.g. task priority and due date)
 * @param workspaceId owning workspace, null for personal entities
 * @param projectIds projects the entity belongs to
 */
public record EntityCreatePayload(
        String entityType,
        String id,
        String title,
        String preview,
        String content,
        FileAttachment file,
        List<String> tags,
        Map<String, Object> metadata,
        String workspaceId,
        List<String> projectIds)
        implements CommandPayload {

    public EntityCreatePayload {
        tags = PayloadChecks.copyOrEmpty(tags);
        metadata = PayloadChecks.copyOrEmpty(metadata);
        projectIds = PayloadChecks.copyOrEmpty(projectIds);
    }

    @Override
    public String resourceId() {
        return id;
    }

    /** True when there is a body to write to the object store. */
    public boolean hasContent() {
        return (content != null && !content.isEmpty()) || file != null;
    }

    @Override
    public List<String> violations() {
        var errors = new ArrayList<String>();
        PayloadChecks.requireText(errors, "entityType", entityType);
        PayloadChecks.optionalUuid(errors, "id", id);
        if (file != null && file.content() == null) {
            errors.add("file.content must not be null");
        }
        return errors;
    }
}
