package com.tessera.eventstore;

import com.tessera.eventmodel.EventEnvelope;

/**
 * An event together with its position in its aggregate stream.
 *
 * @param event the appended envelope
 * @param version 1-based position within the stream of {@code event.subjectId()}
 */
public record StoredEvent(EventEnvelope event, long version) {

    public StoredEvent {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
    }

    StoredEvent withEvent(EventEnvelope updated) {
        return new StoredEvent(updated, version);
    }
}
