package com.tessera.eventmodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JSON serialization and deserialization for {@link EventEnvelope}.
 *
 * <p>WHY Jackson: Spring Boot's default JSON library. The {@code JavaTimeModule} handles {@code
 * Instant} to ISO 8601 conversion. Payloads are written as their concrete record and read back
 * through the {@link SchemaRegistry}, since the event type decides which record the data is.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Serializes an event envelope to a JSON string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(EventEnvelope event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + event.id(), e);
        }
    }

    /** Serializes a payload alone, as stored in the {@code data} column. */
    public static String serializeData(Object data) {
        try {
            return MAPPER.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event data", e);
        }
    }

    /** Reads a JSON object into a plain map, e.g. a stored {@code data} or {@code metadata} column. */
    public static Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to read JSON object", e);
        }
    }

    /** Converts a payload record to its raw map form. */
    public static Map<String, Object> toMap(Object value) {
        return MAPPER.convertValue(value, MAP_TYPE);
    }

    /**
     * Deserializes an envelope, restoring the payload through {@code schemas}.
     *
     * @throws EventSerializationException if the JSON is malformed or lacks a valid type
     */
    public static EventEnvelope deserialize(String json, SchemaRegistry schemas) {
        try {
            Wire wire = MAPPER.readValue(json, Wire.class);
            if (wire.type() == null) {
                throw new EventSerializationException("Event JSON has no type", null);
            }
            return new EventEnvelope(
                    wire.id(),
                    wire.type(),
                    wire.subjectId(),
                    wire.subjectType(),
                    schemas.restore(wire.type(), wire.data()),
                    wire.metadata(),
                    wire.userId(),
                    wire.source(),
                    wire.timestamp(),
                    wire.correlationId(),
                    wire.causationId(),
                    wire.requestId());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
    }

    /** Safely deserializes, returning empty on failure. */
    public static Optional<EventEnvelope> tryDeserialize(String json, SchemaRegistry schemas) {
        try {
            return Optional.of(deserialize(json, schemas));
        } catch (EventSerializationException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private record Wire(
            UUID id,
            EventTypeName type,
            String subjectId,
            String subjectType,
            Map<String, Object> data,
            Map<String, Object> metadata,
            String userId,
            EventSource source,
            Instant timestamp,
            String correlationId,
            String causationId,
            String requestId) {}

    /** Exception thrown when event serialization/deserialization fails. */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
