package com.tessera.eventmodel.payload;

import java.util.ArrayList;
import java.util.List;

/** Data of {@code documents.*.completed}. */
public record DocumentCompletedPayload(
        String documentId, String title, String storagePath, Long size, String checksum, Long version)
        implements EventPayload {

    @Override
    public List<String> violations() {
        var errors = new ArrayList<String>();
        PayloadChecks.requireUuid(errors, "documentId", documentId);
        return errors;
    }
}
