package com.tessera.eventmodel.payload;

import java.util.ArrayList;
import java.util.List;

/**
 * Data of {@code documents.create.*}.
 *
 * @param documentId caller-chosen id (UUID), optional
 * @param title document title; required
 * @param content document body; required, may be empty
 * @param mimeType MIME type of the body, defaults to {@code text/markdown}
 * @param workspaceId owning workspace, null for personal documents
 * @param projectIds projects the document belongs to
 */
public record DocumentCreatePayload(
        String documentId,
        String title,
        String content,
        String mimeType,
        String workspaceId,
        List<String> projectIds)
        implements CommandPayload {

    public DocumentCreatePayload {
        if (mimeType == null || mimeType.isBlank()) {
            mimeType = "text/markdown";
        }
        projectIds = PayloadChecks.copyOrEmpty(projectIds);
    }

    @Override
    public String resourceId() {
        return documentId;
    }

    @Override
    public List<String> violations() {
        var errors = new ArrayList<String>();
        PayloadChecks.optionalUuid(errors, "documentId", documentId);
        PayloadChecks.requireText(errors, "title", title);
        if (content == null) {
            errors.add("content must not be null");
        }
        return errors;
    }
}
