package com.tessera.eventmodel;

import com.tessera.eventmodel.payload.CommandPayload;
import com.tessera.eventmodel.payload.EventPayload;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Creates {@link EventEnvelope} instances.
 *
 * <p>WHY a factory: id and timestamp assignment, schema validation and correlation inheritance
 * happen in one place, so no event reaches the store without them. Caller-supplied maps are copied,
 * never mutated.
 */
public final class EventFactory {

    private final SchemaRegistry schemas;
    private final Clock clock;

    public EventFactory(SchemaRegistry schemas, Clock clock) {
        this.schemas = schemas;
        this.clock = clock;
    }

    public EventFactory(SchemaRegistry schemas) {
        this(schemas, Clock.systemUTC());
    }

    public SchemaRegistry schemas() {
        return schemas;
    }

    /**
     * Creates a root event.
     *
     * @throws SchemaValidationException when {@code input.data()} fails the type's schema
     */
    public EventEnvelope createEvent(EventInput input) {
        EventPayload payload = schemas.validate(input.type(), copy(input.data()));
        String subjectId = input.subjectId() != null ? input.subjectId() : subjectIdFor(payload);
        return new EventEnvelope(
                UUID.randomUUID(),
                input.type(),
                subjectId,
                input.subjectType() != null ? input.subjectType() : input.type().subject(),
                payload,
                copy(input.metadata()),
                input.userId(),
                input.source() != null ? input.source() : EventSource.USER,
                now(),
                input.correlationId() != null
                        ? input.correlationId()
                        : UUID.randomUUID().toString(),
                input.causationId(),
                input.requestId());
    }

    /**
     * Creates the next phase of the same command: same data, subject, user, source, correlation and
     * metadata, with {@code causationId} pointing at the parent.
     */
    public EventEnvelope createChild(EventEnvelope parent, EventPhase phase) {
        return createChild(parent, phase, parent.metadata());
    }

    /** As {@link #createChild(EventEnvelope, EventPhase)} with explicit metadata. */
    public EventEnvelope createChild(
            EventEnvelope parent, EventPhase phase, Map<String, Object> metadata) {
        return createChild(parent, phase, metadata, parent.userId(), parent.source());
    }

    /**
     * Next phase of the same command acted on by someone else, e.g. an approver re-submitting an
     * AI proposal as a person.
     */
    public EventEnvelope createChild(
            EventEnvelope parent,
            EventPhase phase,
            Map<String, Object> metadata,
            String userId,
            EventSource source) {
        return createChild(UUID.randomUUID(), parent, phase, metadata, userId, source);
    }

    /**
     * As {@link #createChild(EventEnvelope, EventPhase, Map)} under a caller-chosen id, typically
     * {@link #followUpId(UUID, String)}.
     */
    public EventEnvelope createChild(
            UUID id, EventEnvelope parent, EventPhase phase, Map<String, Object> metadata) {
        return createChild(id, parent, phase, metadata, parent.userId(), parent.source());
    }

    private EventEnvelope createChild(
            UUID id,
            EventEnvelope parent,
            EventPhase phase,
            Map<String, Object> metadata,
            String userId,
            EventSource source) {
        EventTypeName type = parent.type().withPhase(phase);
        return new EventEnvelope(
                id,
                type,
                parent.subjectId(),
                parent.subjectType(),
                schemas.validate(type, parent.data()),
                copy(metadata),
                userId,
                source,
                now(),
                parent.correlationId(),
                parent.id().toString(),
                parent.requestId());
    }

    /**
     * Creates an event of a different type caused by {@code parent}, e.g. the completion fact a
     * worker emits. Correlation, user and request id are inherited; the source becomes {@link
     * EventSource#SYSTEM}.
     *
     * @throws SchemaValidationException when {@code payload} fails the type's schema
     */
    public EventEnvelope derive(
            EventEnvelope parent,
            EventTypeName type,
            String subjectId,
            EventPayload payload,
            Map<String, Object> metadata) {
        return derive(UUID.randomUUID(), parent, type, subjectId, payload, metadata);
    }

    /** As {@link #derive(EventEnvelope, EventTypeName, String, EventPayload, Map)} under a given id. */
    public EventEnvelope derive(
            UUID id,
            EventEnvelope parent,
            EventTypeName type,
            String subjectId,
            EventPayload payload,
            Map<String, Object> metadata) {
        return new EventEnvelope(
                id,
                type,
                subjectId,
                parent.subjectType(),
                schemas.validate(type, payload),
                copy(metadata),
                parent.userId(),
                EventSource.SYSTEM,
                now(),
                parent.correlationId(),
                parent.id().toString(),
                parent.requestId());
    }

    /**
     * Id of the one follow-up event a handler derives from {@code parentId} in the given role, e.g.
     * the governor's decision on a request. Every delivery of the parent yields the same id, so a
     * redelivered handler appends a copy the store already has instead of a second event.
     */
    public static UUID followUpId(UUID parentId, String role) {
        if (parentId == null || role == null || role.isBlank()) {
            throw new IllegalArgumentException("parentId and role must be set");
        }
        return UUID.nameUUIDFromBytes((parentId + ":" + role).getBytes(StandardCharsets.UTF_8));
    }

    // storage keeps microseconds, so events compare equal after a round trip
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static Map<String, Object> copy(Map<String, Object> map) {
        return map == null ? new LinkedHashMap<>() : new LinkedHashMap<>(map);
    }

    private static String subjectIdFor(EventPayload payload) {
        if (payload instanceof CommandPayload command
                && command.resourceId() != null) {
            return command.resourceId();
        }
        return UUID.randomUUID().toString();
    }
}
