package com.tessera.eventmodel;

import com.tessera.eventmodel.payload.EventPayload;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Canonical envelope for every command and fact flowing through the pipeline.
 *
 * <p>Events are immutable once appended. The only change ever made to a stored event is an
 * additive metadata annotation (see {@link #withAnnotation(String, Object)}), so the record copies
 * its metadata map and exposes it read-only.
 */
public record EventEnvelope(
        /** Unique identifier for this event instance. */
        UUID id,

        /** {@code {subject}.{action}.{phase}}. */
        EventTypeName type,

        /** Aggregate this event belongs to; events sharing it form one stream. */
        String subjectId,

        /** Kind of aggregate, e.g. "entity" or "document". */
        String subjectType,

        /** Payload, checked against the type's registered schema. */
        EventPayload data,

        /** Free-form context: permission decision, AI provenance, execution failures. */
        Map<String, Object> metadata,

        /** Acting user. */
        String userId,

        /** Who originated the command. */
        EventSource source,

        /** When the event was created. */
        Instant timestamp,

        /** Shared by every event of one logical request. */
        String correlationId,

        /** Id of the event that directly caused this one; null for roots. */
        String causationId,

        /** Client-supplied request id used for real-time notification routing. */
        String requestId) {

    public EventEnvelope {
        metadata =
                metadata == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Returns a copy with {@code key} added to the metadata. An existing key is never overwritten,
     * so annotating the same key twice keeps the first value.
     */
    public EventEnvelope withAnnotation(String key, Object value) {
        if (metadata.containsKey(key)) {
            return this;
        }
        var merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new EventEnvelope(
                id,
                type,
                subjectId,
                subjectType,
                data,
                merged,
                userId,
                source,
                timestamp,
                correlationId,
                causationId,
                requestId);
    }

    /** Metadata value for {@code key}, if present. */
    public Optional<Object> metadataValue(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    /** Phase of this event, shorthand for {@code type().phase()}. */
    public EventPhase phase() {
        return type.phase();
    }
}
