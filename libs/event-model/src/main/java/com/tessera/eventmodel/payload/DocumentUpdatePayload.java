package com.tessera.eventmodel.payload;

import java.util.ArrayList;
import java.util.List;

/** Data of {@code documents.update.*}. Null fields are left unchanged. */
public record DocumentUpdatePayload(
        String documentId,
        String title,
        String content,
        Long expectedVersion,
        String workspaceId,
        List<String> projectIds)
        implements CommandPayload {

    public DocumentUpdatePayload {
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
        PayloadChecks.optionalPositive(errors, "expectedVersion", expectedVersion);
        if (title == null && content == null) {
            errors.add("at least one of title or content must be present");
        }
        return errors;
    }
}
