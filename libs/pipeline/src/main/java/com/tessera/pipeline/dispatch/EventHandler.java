package com.tessera.pipeline.dispatch;

import com.tessera.eventmodel.EventEnvelope;

/** Reacts to one dispatched event. */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handles an event. Any exception is isolated by the dispatcher and reported as a failed
     * outcome; it never reaches other handlers of the same event.
     *
     * @return a short description of what was done, shown in the dispatch summary (may be null)
     */
    Object handle(EventEnvelope event) throws Exception;
}
