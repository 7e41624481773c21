package com.tessera.pipeline.storage;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDocumentRepository implements DocumentRepository {

    private final Map<String, DocumentRow> rows = new ConcurrentHashMap<>();

    @Override
    public DocumentRow insertIfAbsent(DocumentRow row) {
        DocumentRow existing = rows.putIfAbsent(row.id(), row);
        return existing != null ? existing : row;
    }

    @Override
    public Optional<DocumentRow> findById(String id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public boolean replace(DocumentRow updated, long expectedVersion) {
        boolean[] replaced = {false};
        rows.computeIfPresent(
                updated.id(),
                (id, current) -> {
                    if (current.version() != expectedVersion) {
                        return current;
                    }
                    replaced[0] = true;
                    return updated;
                });
        return replaced[0];
    }

    @Override
    public Optional<DocumentRow> softDelete(String id, Instant deletedAt, String eventId) {
        return Optional.ofNullable(
                rows.computeIfPresent(
                        id,
                        (key, row) ->
                                row.isDeleted()
                                        ? row
                                        : new DocumentRow(
                                                row.id(), row.userId(), row.workspaceId(), row.title(),
                                                row.mimeType(), row.storagePath(), row.size(),
                                                row.checksum(), row.version() + 1, row.createdAt(),
                                                deletedAt, deletedAt, eventId)));
    }

    public int count() {
        return rows.size();
    }
}
