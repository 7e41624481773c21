package com.tessera.eventstore;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.EventSerializer;
import com.tessera.eventmodel.EventSource;
import com.tessera.eventmodel.EventTypeName;
import com.tessera.eventmodel.SchemaRegistry;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * {@link EventStore} on the {@code event_log} table created by the Flyway migrations.
 *
 * <p>Versions are assigned optimistically: the writer reads the stream's current version and
 * inserts the next one. The {@code (subject_id, version)} unique constraint turns a lost race into
 * a {@link DuplicateKeyException}, after which a plain append retries and an expected-version append
 * fails with {@link ConcurrencyConflictException}. No row or table locks are taken.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final int MAX_APPEND_ATTEMPTS = 50;

    private static final String COLUMNS =
            "id, event_type, subject_id, subject_type, version, data, metadata, user_id, source,"
                    + " occurred_at, correlation_id, causation_id, request_id";

    private final JdbcClient jdbc;
    private final SchemaRegistry schemas;

    public JdbcEventStore(JdbcClient jdbc, SchemaRegistry schemas) {
        this.jdbc = jdbc;
        this.schemas = schemas;
    }

    @Override
    public StoredEvent append(EventEnvelope event) {
        return doAppend(event).stored();
    }

    @Override
    public Optional<StoredEvent> appendIfAbsent(EventEnvelope event) {
        Appended appended = doAppend(event);
        return appended.created() ? Optional.of(appended.stored()) : Optional.empty();
    }

    private record Appended(StoredEvent stored, boolean created) {}

    private Appended doAppend(EventEnvelope event) {
        AppendChecks.check(schemas, event);
        for (int attempt = 1; ; attempt++) {
            Optional<StoredEvent> existing = findById(event.id());
            if (existing.isPresent()) {
                log.debug("Event {} already appended, returning stored copy", event.id());
                return new Appended(existing.get(), false);
            }
            long next = currentVersion(event.subjectId()) + 1;
            try {
                return new Appended(insert(event, next), true);
            } catch (DuplicateKeyException e) {
                // either the id (primary key) or the stream slot was taken; the next pass tells which
                if (attempt >= MAX_APPEND_ATTEMPTS) {
                    throw new IllegalStateException(
                            "Could not append to stream " + event.subjectId() + " after "
                                    + attempt + " attempts",
                            e);
                }
                log.debug("Lost race on stream {} at version {}, retrying", event.subjectId(), next);
            }
        }
    }

    @Override
    public StoredEvent append(EventEnvelope event, long expectedVersion) {
        AppendChecks.check(schemas, event);
        Optional<StoredEvent> existing = findById(event.id());
        if (existing.isPresent()) {
            return existing.get();
        }
        long actual = currentVersion(event.subjectId());
        if (actual != expectedVersion) {
            throw new ConcurrencyConflictException(event.subjectId(), expectedVersion, actual);
        }
        try {
            return insert(event, expectedVersion + 1);
        } catch (DuplicateKeyException e) {
            Optional<StoredEvent> raced = findById(event.id());
            if (raced.isPresent()) {
                return raced.get();
            }
            throw new ConcurrencyConflictException(
                    event.subjectId(), expectedVersion, currentVersion(event.subjectId()));
        }
    }

    private StoredEvent insert(EventEnvelope event, long version) {
        jdbc.sql("INSERT INTO event_log (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")
                .params(
                        event.id(),
                        event.type().value(),
                        event.subjectId(),
                        event.subjectType(),
                        version,
                        EventSerializer.serializeData(event.data()),
                        EventSerializer.serializeData(event.metadata()),
                        event.userId(),
                        event.source().value(),
                        Timestamp.from(event.timestamp()),
                        event.correlationId(),
                        event.causationId(),
                        event.requestId())
                .update();
        log.debug("Appended {} {} as version {}", event.type(), event.id(), version);
        return new StoredEvent(event, version);
    }

    @Override
    public BatchAppendResult appendBatch(List<EventEnvelope> events) {
        var items = new ArrayList<BatchAppendResult.Item>(events.size());
        for (int i = 0; i < events.size(); i++) {
            EventEnvelope event = events.get(i);
            UUID id = event == null ? null : event.id();
            try {
                items.add(new BatchAppendResult.Item(i, id, append(event), null));
            } catch (RuntimeException e) {
                log.warn("Batch item {} ({}) rejected: {}", i, id, e.getMessage());
                items.add(new BatchAppendResult.Item(i, id, null, e.getMessage()));
            }
        }
        return new BatchAppendResult(items);
    }

    @Override
    public List<StoredEvent> getAggregateStream(String subjectId) {
        return jdbc.sql("SELECT " + COLUMNS + " FROM event_log WHERE subject_id = ? ORDER BY version")
                .param(subjectId)
                .query(this::mapRow)
                .list();
    }

    @Override
    public OptionalLong getAggregateVersion(String subjectId) {
        long version = currentVersion(subjectId);
        return version == 0 ? OptionalLong.empty() : OptionalLong.of(version);
    }

    private long currentVersion(String subjectId) {
        Long max =
                jdbc.sql("SELECT MAX(version) FROM event_log WHERE subject_id = ?")
                        .param(subjectId)
                        .query(Long.class)
                        .optional()
                        .orElse(null);
        return max == null ? 0 : max;
    }

    @Override
    public Optional<StoredEvent> findById(UUID eventId) {
        return jdbc.sql("SELECT " + COLUMNS + " FROM event_log WHERE id = ?")
                .param(eventId)
                .query(this::mapRow)
                .optional();
    }

    @Override
    public List<StoredEvent> getCorrelatedEvents(String correlationId) {
        return jdbc.sql(
                        "SELECT " + COLUMNS
                                + " FROM event_log WHERE correlation_id = ?"
                                + " ORDER BY occurred_at, version")
                .param(correlationId)
                .query(this::mapRow)
                .list();
    }

    @Override
    public List<StoredEvent> readAll(Instant fromInclusive) {
        Instant from = fromInclusive == null ? Instant.EPOCH : fromInclusive;
        return jdbc.sql(
                        "SELECT " + COLUMNS
                                + " FROM event_log WHERE occurred_at >= ?"
                                + " ORDER BY occurred_at, version")
                .param(Timestamp.from(from))
                .query(this::mapRow)
                .list();
    }

    @Override
    public StoredEvent annotate(UUID eventId, String key, Object value) {
        for (int attempt = 1; attempt <= MAX_APPEND_ATTEMPTS; attempt++) {
            MetadataRow current =
                    jdbc.sql("SELECT metadata, metadata_revision FROM event_log WHERE id = ?")
                            .param(eventId)
                            .query(
                                    (rs, n) ->
                                            new MetadataRow(
                                                    rs.getString("metadata"),
                                                    rs.getInt("metadata_revision")))
                            .optional()
                            .orElseThrow(() -> new UnknownEventException(eventId));
            var metadata = new LinkedHashMap<>(EventSerializer.readMap(current.json()));
            if (metadata.containsKey(key)) {
                return findById(eventId).orElseThrow(() -> new UnknownEventException(eventId));
            }
            metadata.put(key, value);
            int updated =
                    jdbc.sql(
                                    "UPDATE event_log SET metadata = ?, metadata_revision = ?"
                                            + " WHERE id = ? AND metadata_revision = ?")
                            .params(
                                    EventSerializer.serializeData(metadata),
                                    current.revision() + 1,
                                    eventId,
                                    current.revision())
                            .update();
            if (updated == 1) {
                return findById(eventId).orElseThrow(() -> new UnknownEventException(eventId));
            }
        }
        throw new IllegalStateException("Could not annotate event " + eventId + ": concurrent updates");
    }

    private record MetadataRow(String json, int revision) {}

    private StoredEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
        EventTypeName type = EventTypeName.parse(rs.getString("event_type"));
        var event =
                new EventEnvelope(
                        rs.getObject("id", UUID.class),
                        type,
                        rs.getString("subject_id"),
                        rs.getString("subject_type"),
                        schemas.restore(type, EventSerializer.readMap(rs.getString("data"))),
                        EventSerializer.readMap(rs.getString("metadata")),
                        rs.getString("user_id"),
                        EventSource.fromString(rs.getString("source")).orElse(EventSource.SYSTEM),
                        rs.getTimestamp("occurred_at").toInstant(),
                        rs.getString("correlation_id"),
                        rs.getString("causation_id"),
                        rs.getString("request_id"));
        return new StoredEvent(event, rs.getLong("version"));
    }
}
