package com.tessera.eventmodel;

import com.tessera.eventmodel.payload.EventPayload;
import java.util.List;
import java.util.Map;

/**
 * Turns raw event data into one closed payload type.
 *
 * @param <T> the payload record this schema produces
 */
public interface PayloadSchema<T extends EventPayload> {

    /** The payload type instances of this schema produce. */
    Class<T> payloadType();

    /**
     * Parses and checks raw data.
     *
     * @throws SchemaValidationException listing every problem found
     */
    T parse(String eventType, Map<String, Object> raw);

    /** Problems with an already typed payload; empty when it is acceptable for this schema. */
    default List<String> check(EventPayload payload) {
        if (!payloadType().isInstance(payload)) {
            return List.of(
                    "data must be "
                            + payloadType().getSimpleName()
                            + " but was "
                            + (payload == null ? "null" : payload.getClass().getSimpleName()));
        }
        return payload.violations();
    }
}
