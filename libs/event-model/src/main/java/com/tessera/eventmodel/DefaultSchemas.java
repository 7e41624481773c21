package com.tessera.eventmodel;

import com.tessera.eventmodel.payload.DocumentCompletedPayload;
import com.tessera.eventmodel.payload.DocumentCreatePayload;
import com.tessera.eventmodel.payload.DocumentDeletePayload;
import com.tessera.eventmodel.payload.DocumentUpdatePayload;
import com.tessera.eventmodel.payload.EntityCompletedPayload;
import com.tessera.eventmodel.payload.EntityCreatePayload;
import com.tessera.eventmodel.payload.EntityDeletePayload;
import com.tessera.eventmodel.payload.EntityUpdatePayload;
import com.tessera.eventmodel.payload.ThreadCompletedPayload;

/** Built-in event types. */
public final class DefaultSchemas {

    public static final String ENTITIES = "entities";
    public static final String DOCUMENTS = "documents";
    public static final String THREADS = "threads";

    private DefaultSchemas() {
        // utility class
    }

    /** A fresh registry holding every built-in type. */
    public static SchemaRegistry registry() {
        return registerAll(new SchemaRegistry());
    }

    public static SchemaRegistry registerAll(SchemaRegistry registry) {
        var entityDone = RecordPayloadSchema.of(EntityCompletedPayload.class);
        registry.registerCommand(
                ENTITIES, "create", RecordPayloadSchema.of(EntityCreatePayload.class), entityDone);
        registry.registerCommand(
                ENTITIES, "update", RecordPayloadSchema.of(EntityUpdatePayload.class), entityDone);
        registry.registerCommand(
                ENTITIES, "delete", RecordPayloadSchema.of(EntityDeletePayload.class), entityDone);

        var documentDone = RecordPayloadSchema.of(DocumentCompletedPayload.class);
        registry.registerCommand(
                DOCUMENTS, "create", RecordPayloadSchema.of(DocumentCreatePayload.class), documentDone);
        registry.registerCommand(
                DOCUMENTS, "update", RecordPayloadSchema.of(DocumentUpdatePayload.class), documentDone);
        registry.registerCommand(
                DOCUMENTS, "delete", RecordPayloadSchema.of(DocumentDeletePayload.class), documentDone);

        var threadDone = RecordPayloadSchema.of(ThreadCompletedPayload.class);
        for (String action : new String[] {"create", "branch", "merge"}) {
            registry.register(EventTypeName.of(THREADS, action, EventPhase.COMPLETED), threadDone);
        }
        return registry;
    }
}
