package com.tessera.pipeline.storage;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stored entity (note, task, project, ...). Rows are never physically removed; {@code deletedAt}
 * marks a soft delete. {@code lastEventId} is the validated command that wrote the current
 * version, which lets a retried command recognise a write of its own that already landed.
 */
public record EntityRow(
        String id,
        String userId,
        String workspaceId,
        String entityType,
        String title,
        String preview,
        String filePath,
        String fileUrl,
        Long fileSize,
        String checksum,
        List<String> tags,
        List<String> projectIds,
        Map<String, Object> metadata,
        long version,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt,
        String lastEventId) {

    public EntityRow {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
        projectIds = projectIds == null ? List.of() : List.copyOf(projectIds);
        metadata =
                metadata == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /** True when the current version was written by {@code eventId}. */
    public boolean writtenBy(String eventId) {
        return eventId != null && eventId.equals(lastEventId);
    }
}
