package com.tessera.eventmodel.payload;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Map;

/**
 * Raw data of an event type that has no registered schema. Kept as-is and explicitly tagged so
 * consumers never mistake it for checked data.
 */
public record UnvalidatedPayload(Map<String, Object> raw) implements EventPayload {

    public UnvalidatedPayload {
        raw = PayloadChecks.copyOrEmpty(raw);
    }

    @JsonValue
    @Override
    public Map<String, Object> raw() {
        return raw;
    }

    @Override
    public List<String> violations() {
        return List.of();
    }
}
