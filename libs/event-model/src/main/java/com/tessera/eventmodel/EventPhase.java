package com.tessera.eventmodel;

import java.util.Optional;

/**
 * Lifecycle phase of a command, encoded as the last segment of an event type.
 *
 * <pre>
 * requested ──► validated ──► completed
 *          ├──► pending   (awaits a human decision)
 *          └──► denied
 * </pre>
 */
public enum EventPhase {
    REQUESTED("requested"),
    VALIDATED("validated"),
    PENDING("pending"),
    DENIED("denied"),
    COMPLETED("completed");

    private final String value;

    EventPhase(String value) {
        this.value = value;
    }

    /** The canonical segment used in event type names (e.g. "validated"). */
    public String value() {
        return value;
    }

    /** Phases after which nothing else happens to the command. */
    public boolean isTerminal() {
        return this == DENIED || this == COMPLETED;
    }

    public static Optional<EventPhase> fromString(String value) {
        for (EventPhase phase : values()) {
            if (phase.value.equals(value)) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }
}
