package com.tessera.pipeline.projection;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryProjectionStore implements ProjectionStore {

    private final Map<String, EnrichmentRow> enrichments = new ConcurrentSkipListMap<>();
    private final Map<String, RelationshipRow> relationships = new ConcurrentSkipListMap<>();
    private final Map<String, ReasoningTraceRow> traces = new ConcurrentSkipListMap<>();

    @Override
    public boolean insertEnrichment(EnrichmentRow row) {
        return enrichments.putIfAbsent(row.sourceEventId() + "|" + row.enrichmentType(), row) == null;
    }

    @Override
    public boolean insertRelationship(RelationshipRow row) {
        String key =
                String.join(
                        "|",
                        row.sourceEventId(),
                        row.sourceEntityId(),
                        row.targetEntityId(),
                        row.relationshipType());
        return relationships.putIfAbsent(key, row) == null;
    }

    @Override
    public boolean insertReasoningTrace(ReasoningTraceRow row) {
        return traces.putIfAbsent(row.sourceEventId(), row) == null;
    }

    @Override
    public List<EnrichmentRow> enrichmentsFor(String entityId) {
        return enrichments.values().stream().filter(r -> r.entityId().equals(entityId)).toList();
    }

    @Override
    public List<RelationshipRow> relationshipsFrom(String entityId) {
        return relationships.values().stream()
                .filter(r -> Objects.equals(r.sourceEntityId(), entityId))
                .toList();
    }

    @Override
    public Optional<ReasoningTraceRow> reasoningTraceFor(String sourceEventId) {
        return Optional.ofNullable(traces.get(sourceEventId));
    }

    @Override
    public List<EnrichmentRow> allEnrichments() {
        return List.copyOf(enrichments.values());
    }

    @Override
    public List<RelationshipRow> allRelationships() {
        return List.copyOf(relationships.values());
    }

    @Override
    public List<ReasoningTraceRow> allReasoningTraces() {
        return List.copyOf(traces.values());
    }
}
