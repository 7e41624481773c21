package com.tessera.eventmodel;

import com.tessera.eventmodel.payload.CommandPayload;
import com.tessera.eventmodel.payload.EventPayload;
import com.tessera.eventmodel.payload.UnvalidatedPayload;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps each event type to exactly one payload schema.
 *
 * <p>An explicit value, constructed once at startup and passed to whoever needs it. Types that were
 * never registered are let through as {@link UnvalidatedPayload} with a warning, so new producers
 * are not blocked while the gap stays visible in the logs and in the data itself.
 */
public final class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<EventTypeName, PayloadSchema<?>> schemas = new ConcurrentHashMap<>();

    /**
     * Registers the schema for one event type.
     *
     * @throws IllegalStateException if the type already has a schema
     */
    public SchemaRegistry register(EventTypeName type, PayloadSchema<?> schema) {
        PayloadSchema<?> previous = schemas.putIfAbsent(type, schema);
        if (previous != null) {
            throw new IllegalStateException(
                    "Schema already registered for " + type + ": " + previous);
        }
        return this;
    }

    /**
     * Registers a command: {@code commandSchema} for the requested, validated, pending and denied
     * phases and {@code completionSchema} for the completed phase.
     */
    public SchemaRegistry registerCommand(
            String subject,
            String action,
            PayloadSchema<? extends CommandPayload> commandSchema,
            PayloadSchema<?> completionSchema) {
        for (EventPhase phase : EnumSet.complementOf(EnumSet.of(EventPhase.COMPLETED))) {
            register(EventTypeName.of(subject, action, phase), commandSchema);
        }
        return register(EventTypeName.of(subject, action, EventPhase.COMPLETED), completionSchema);
    }

    public boolean isRegistered(EventTypeName type) {
        return schemas.containsKey(type);
    }

    public Optional<PayloadSchema<?>> schemaFor(EventTypeName type) {
        return Optional.ofNullable(schemas.get(type));
    }

    /**
     * Validates raw data for {@code type}.
     *
     * @throws SchemaValidationException listing every error when the data does not match
     */
    public EventPayload validate(EventTypeName type, Map<String, Object> raw) {
        PayloadSchema<?> schema = schemas.get(type);
        if (schema == null) {
            log.warn("No schema registered for event type {}; payload accepted unvalidated", type);
            return new UnvalidatedPayload(raw);
        }
        return schema.parse(type.value(), raw);
    }

    /**
     * Checks an already typed payload against the schema for {@code type}.
     *
     * @throws SchemaValidationException when the payload has the wrong type or violations
     */
    public EventPayload validate(EventTypeName type, EventPayload payload) {
        PayloadSchema<?> schema = schemas.get(type);
        if (schema == null) {
            if (!(payload instanceof UnvalidatedPayload)) {
                log.warn("No schema registered for event type {}; payload accepted unchecked", type);
            }
            return payload;
        }
        var errors = schema.check(payload);
        if (!errors.isEmpty()) {
            throw new SchemaValidationException(type.value(), errors);
        }
        return payload;
    }

    /**
     * Rebuilds the payload of a stored event. Stored data was validated when it was appended, so no
     * checks run here; data that no longer converts is kept as {@link UnvalidatedPayload}.
     */
    public EventPayload restore(EventTypeName type, Map<String, Object> raw) {
        PayloadSchema<?> schema = schemas.get(type);
        if (schema == null) {
            return new UnvalidatedPayload(raw);
        }
        try {
            if (schema instanceof RecordPayloadSchema<?> recordSchema) {
                return recordSchema.restore(raw);
            }
            return schema.parse(type.value(), raw);
        } catch (IllegalArgumentException e) {
            log.warn("Stored payload of {} no longer matches its schema: {}", type, e.getMessage());
            return new UnvalidatedPayload(raw);
        }
    }
}
