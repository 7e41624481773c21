package com.tessera.eventmodel.payload;

import java.util.List;

/**
 * Payload of a mutating command. The same record travels unchanged through the requested,
 * validated, pending and denied phases.
 */
public sealed interface CommandPayload extends EventPayload
        permits EntityCreatePayload,
                EntityUpdatePayload,
                EntityDeletePayload,
                DocumentCreatePayload,
                DocumentUpdatePayload,
                DocumentDeletePayload {

    /** Identifier of the existing resource the command targets; null for creates without an id. */
    String resourceId();

    /** Workspace owning the resource; null for personal resources. */
    String workspaceId();

    /** Projects the resource belongs to; empty when it has no project scope. */
    List<String> projectIds();
}
