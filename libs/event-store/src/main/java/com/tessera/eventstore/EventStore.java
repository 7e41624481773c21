package com.tessera.eventstore;

import com.tessera.eventmodel.EventEnvelope;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Append-only log of events, grouped into per-aggregate streams by {@code subjectId}.
 *
 * <p>Within a stream, versions start at 1 and increase by one per append. There is no total order
 * across streams: readers that need cross-aggregate causality follow {@code correlationId} and
 * {@code causationId}.
 */
public interface EventStore {

    /**
     * Validates and appends an event at the end of its stream. Appending an event whose id is
     * already stored returns the stored copy, so redelivered appends are harmless.
     *
     * @throws com.tessera.eventmodel.SchemaValidationException when the payload fails its schema
     * @throws com.tessera.eventmodel.EventValidationException when the envelope is malformed
     */
    StoredEvent append(EventEnvelope event);

    /**
     * Appends only if the stream is currently at {@code expectedVersion} (0 for a new stream).
     *
     * @throws ConcurrencyConflictException when another writer got there first
     */
    StoredEvent append(EventEnvelope event, long expectedVersion);

    /**
     * As {@link #append(EventEnvelope)}, but tells the caller whether this call stored the event.
     * Of any number of concurrent appends of one event id exactly one gets a stored event back.
     *
     * @return the newly stored event, or empty when an event with the same id was already stored
     */
    Optional<StoredEvent> appendIfAbsent(EventEnvelope event);

    /** Appends each event independently; one failure does not stop the rest. */
    BatchAppendResult appendBatch(List<EventEnvelope> events);

    /** Every event of one aggregate in version order; empty when the aggregate is unknown. */
    List<StoredEvent> getAggregateStream(String subjectId);

    /** Current version of an aggregate, empty when it has no events. */
    OptionalLong getAggregateVersion(String subjectId);

    Optional<StoredEvent> findById(UUID eventId);

    /** Every event sharing {@code correlationId}, oldest first. */
    List<StoredEvent> getCorrelatedEvents(String correlationId);

    /** Every event at or after {@code fromInclusive}, in timestamp order. */
    List<StoredEvent> readAll(Instant fromInclusive);

    /**
     * Adds a metadata key to a stored event. Keys already present are kept (first write wins), so
     * re-running an annotation is a no-op.
     *
     * @throws UnknownEventException when no event has that id
     */
    StoredEvent annotate(UUID eventId, String key, Object value);
}
