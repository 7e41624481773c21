package com.tessera.pipeline.storage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Entity rows, written only by the entities worker. */
public interface EntityRepository {

    /**
     * Inserts {@code row} unless a row with the same id exists.
     *
     * @return the stored row: {@code row} or the one already there
     */
    EntityRow insertIfAbsent(EntityRow row);

    Optional<EntityRow> findById(String id);

    /**
     * Replaces a row when its stored version is {@code expectedVersion}.
     *
     * @return true if the row was replaced
     */
    boolean replace(EntityRow updated, long expectedVersion);

    /** Rows visible to a tenant: the workspace's rows, or the user's personal rows. */
    List<EntityRow> findVisible(String userId, String workspaceId);

    /**
     * Marks a row deleted on behalf of {@code eventId}; a row that is already deleted keeps its first
     * timestamp and deleting event.
     */
    Optional<EntityRow> softDelete(String id, Instant deletedAt, String eventId);
}
