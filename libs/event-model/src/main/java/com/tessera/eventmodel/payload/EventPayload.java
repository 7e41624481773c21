package com.tessera.eventmodel.payload;

import java.util.List;

/**
 * Closed set of payloads an event can carry.
 *
 * <p>Each registered event type maps to exactly one of these records. Types nobody registered
 * travel as {@link UnvalidatedPayload} so consumers can tell at a glance that the data was never
 * checked against a schema.
 */
public sealed interface EventPayload
        permits CommandPayload,
                EntityCompletedPayload,
                DocumentCompletedPayload,
                ThreadCompletedPayload,
                UnvalidatedPayload {

    /**
     * Field-level problems with this payload, empty when it is valid. All problems are reported at
     * once rather than failing on the first.
     */
    List<String> violations();
}
