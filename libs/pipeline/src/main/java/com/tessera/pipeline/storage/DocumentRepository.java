package com.tessera.pipeline.storage;

import java.time.Instant;
import java.util.Optional;

/** Document rows, written only by the documents worker. */
public interface DocumentRepository {

    DocumentRow insertIfAbsent(DocumentRow row);

    Optional<DocumentRow> findById(String id);

    /** Replaces a row when its stored version is {@code expectedVersion}. */
    boolean replace(DocumentRow updated, long expectedVersion);

    /** Marks a row deleted on behalf of {@code eventId}; an already deleted row is left as is. */
    Optional<DocumentRow> softDelete(String id, Instant deletedAt, String eventId);
}
