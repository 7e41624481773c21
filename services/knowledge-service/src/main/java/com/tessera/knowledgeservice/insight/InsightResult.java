package com.tessera.knowledgeservice.insight;

import java.util.List;
import java.util.UUID;

/** What became of an insight's actions. */
public record InsightResult(int eventsPublished, List<UUID> eventIds, List<ActionFailure> failures) {

    public record ActionFailure(int actionIndex, String error) {}

    public InsightResult {
        eventIds = List.copyOf(eventIds);
        failures = List.copyOf(failures);
    }
}
