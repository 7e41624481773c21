package com.tessera.eventstore;

import java.util.UUID;

/** Thrown when an operation names an event id that was never appended. */
public class UnknownEventException extends RuntimeException {

    private final UUID eventId;

    public UnknownEventException(UUID eventId) {
        super("Unknown event: " + eventId);
        this.eventId = eventId;
    }

    public UUID eventId() {
        return eventId;
    }
}
