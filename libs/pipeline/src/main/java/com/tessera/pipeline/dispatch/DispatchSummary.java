package com.tessera.pipeline.dispatch;

import java.util.List;
import java.util.UUID;

/**
 * Aggregate result of dispatching one event to every matching handler.
 *
 * @param eventId the dispatched event
 * @param eventType its type
 * @param handlerCount number of handlers that matched
 * @param successful number that completed normally
 * @param failed number that threw
 * @param results one outcome per handler, in registration order
 */
public record DispatchSummary(
        UUID eventId,
        String eventType,
        int handlerCount,
        int successful,
        int failed,
        List<HandlerOutcome> results) {

    public DispatchSummary {
        results = List.copyOf(results);
    }

    /** Summary of an event that was not dispatched at all. */
    public static DispatchSummary none(UUID eventId, String eventType) {
        return new DispatchSummary(eventId, eventType, 0, 0, 0, List.of());
    }

    static DispatchSummary of(UUID eventId, String eventType, List<HandlerOutcome> results) {
        int successful = (int) results.stream().filter(HandlerOutcome::succeeded).count();
        return new DispatchSummary(
                eventId, eventType, results.size(), successful, results.size() - successful, results);
    }
}
