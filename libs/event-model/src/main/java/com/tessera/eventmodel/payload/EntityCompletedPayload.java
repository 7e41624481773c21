package com.tessera.eventmodel.payload;

import java.util.ArrayList;
import java.util.List;

/**
 * Data of {@code entities.*.completed}: identifiers of what the worker wrote.
 *
 * @param entityId the entity row id
 * @param entityType kind of entity; null for update/delete completions
 * @param title title after the mutation
 * @param fileUrl object store URL of the body, if any
 * @param filePath object store path of the body, if any
 * @param fileSize body size in bytes
 * @param checksum {@code sha256:<hex>} of the body
 * @param version row version after the mutation
 */
public record EntityCompletedPayload(
        String entityId,
        String entityType,
        String title,
        String fileUrl,
        String filePath,
        Long fileSize,
        String checksum,
        Long version)
        implements EventPayload {

    @Override
    public List<String> violations() {
        var errors = new ArrayList<String>();
        PayloadChecks.requireUuid(errors, "entityId", entityId);
        return errors;
    }
}
