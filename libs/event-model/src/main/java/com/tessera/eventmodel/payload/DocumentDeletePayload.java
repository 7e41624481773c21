package com.tessera.eventmodel.payload;

import java.util.ArrayList;
import java.util.List;

/** Data of {@code documents.delete.*}. */
public record DocumentDeletePayload(String documentId, String workspaceId, List<String> projectIds)
        implements CommandPayload {

    public DocumentDeletePayload {
        projectIds = PayloadChecks.copyOrEmpty(projectIds);
    }

    @Override
    public String resourceId() {
        return documentId;
    }

    @Override
    public List<String> violations() {
        var errors = new ArrayList<String>();
        PayloadChecks.requireUuid(errors, "documentId", documentId);
        return errors;
    }
}
