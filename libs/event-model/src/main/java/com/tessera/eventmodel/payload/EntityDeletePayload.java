package com.tessera.eventmodel.payload;

import java.util.ArrayList;
import java.util.List;

/** Data of {@code entities.delete.*}. */
public record EntityDeletePayload(String entityId, String workspaceId, List<String> projectIds)
        implements CommandPayload {

    public EntityDeletePayload {
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
        return errors;
    }
}
