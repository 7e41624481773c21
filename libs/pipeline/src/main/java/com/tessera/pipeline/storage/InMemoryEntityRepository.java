package com.tessera.pipeline.storage;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEntityRepository implements EntityRepository {

    private final Map<String, EntityRow> rows = new ConcurrentHashMap<>();

    @Override
    public EntityRow insertIfAbsent(EntityRow row) {
        EntityRow existing = rows.putIfAbsent(row.id(), row);
        return existing != null ? existing : row;
    }

    @Override
    public Optional<EntityRow> findById(String id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public boolean replace(EntityRow updated, long expectedVersion) {
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
    public List<EntityRow> findVisible(String userId, String workspaceId) {
        return rows.values().stream()
                .filter(row -> !row.isDeleted())
                .filter(
                        row ->
                                workspaceId != null
                                        ? workspaceId.equals(row.workspaceId())
                                        : row.workspaceId() == null
                                                && Objects.equals(userId, row.userId()))
                .toList();
    }

    @Override
    public Optional<EntityRow> softDelete(String id, Instant deletedAt, String eventId) {
        return Optional.ofNullable(
                rows.computeIfPresent(
                        id,
                        (key, row) ->
                                row.isDeleted()
                                        ? row
                                        : new EntityRow(
                                                row.id(), row.userId(), row.workspaceId(),
                                                row.entityType(), row.title(), row.preview(),
                                                row.filePath(), row.fileUrl(), row.fileSize(),
                                                row.checksum(), row.tags(), row.projectIds(),
                                                row.metadata(), row.version() + 1, row.createdAt(),
                                                deletedAt, deletedAt, eventId)));
    }

    public int count() {
        return rows.size();
    }
}
