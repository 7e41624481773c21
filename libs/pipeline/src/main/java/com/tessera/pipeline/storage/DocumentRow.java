package com.tessera.pipeline.storage;

import java.time.Instant;

/**
 * Stored document; the body lives in the object store under {@code storagePath}. {@code
 * lastEventId} is the validated command that wrote the current version.
 */
public record DocumentRow(
        String id,
        String userId,
        String workspaceId,
        String title,
        String mimeType,
        String storagePath,
        long size,
        String checksum,
        long version,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt,
        String lastEventId) {

    public DocumentRow {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean writtenBy(String eventId) {
        return eventId != null && eventId.equals(lastEventId);
    }
}
