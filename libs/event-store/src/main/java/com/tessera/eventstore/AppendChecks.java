package com.tessera.eventstore;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.EventValidator;
import com.tessera.eventmodel.SchemaRegistry;

/** Checks every store runs before an event is written. */
final class AppendChecks {

    private AppendChecks() {
        // utility class
    }

    static void check(SchemaRegistry schemas, EventEnvelope event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        EventValidator.validate(event).orThrow();
        schemas.validate(event.type(), event.data());
    }
}
