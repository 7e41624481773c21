package com.tessera.pipeline.governor;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.EventSerializer;
import com.tessera.security.PermissionDecision;
import java.util.Map;
import java.util.Optional;

/**
 * Converts permission decisions to and from the plain maps stored in event metadata. Metadata is
 * persisted as JSON, so a decision read back from the store is always a map.
 */
public final class DecisionMetadata {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private DecisionMetadata() {
        // utility class
    }

    public static Map<String, Object> toMetadata(PermissionDecision decision) {
        return EventSerializer.objectMapper().convertValue(decision, MAP);
    }

    /** The decision recorded on {@code event}, if any. */
    public static Optional<PermissionDecision> fromEvent(EventEnvelope event) {
        return event.metadataValue(PermissionDecision.METADATA_KEY).map(DecisionMetadata::convert);
    }

    private static PermissionDecision convert(Object value) {
        if (value instanceof PermissionDecision decision) {
            return decision;
        }
        return EventSerializer.objectMapper().convertValue(value, PermissionDecision.class);
    }
}
