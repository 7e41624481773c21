package com.tessera.eventmodel;

import java.util.List;

/** Thrown when an envelope is structurally invalid (missing id, user, timestamp and so on). */
public class EventValidationException extends RuntimeException {

    private final List<String> errors;

    public EventValidationException(ValidationResult result) {
        super("Invalid event envelope: " + String.join("; ", result.errors()));
        this.errors = result.errors();
    }

    public List<String> errors() {
        return errors;
    }
}
