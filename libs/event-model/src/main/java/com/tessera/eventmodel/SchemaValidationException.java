package com.tessera.eventmodel;

import java.util.List;

/** Thrown when a payload does not satisfy the schema registered for its event type. */
public class SchemaValidationException extends RuntimeException {

    private final String eventType;
    private final List<String> errors;

    public SchemaValidationException(String eventType, List<String> errors) {
        super("Invalid payload for " + eventType + ": " + String.join("; ", errors));
        this.eventType = eventType;
        this.errors = List.copyOf(errors);
    }

    public String eventType() {
        return eventType;
    }

    /** Every problem found, never empty. */
    public List<String> errors() {
        return errors;
    }
}
