package com.tessera.pipeline.projection;

import java.util.List;
import java.util.Optional;

/**
 * Derived AI provenance tables. Every insert is insert-if-absent on the row's natural key, so
 * replaying an event never duplicates rows.
 */
public interface ProjectionStore {

    /** Keyed by {@code (sourceEventId, enrichmentType)}; returns true when inserted. */
    boolean insertEnrichment(EnrichmentRow row);

    /** Keyed by {@code (sourceEventId, sourceEntityId, targetEntityId, relationshipType)}. */
    boolean insertRelationship(RelationshipRow row);

    /** Keyed by {@code sourceEventId}. */
    boolean insertReasoningTrace(ReasoningTraceRow row);

    List<EnrichmentRow> enrichmentsFor(String entityId);

    List<RelationshipRow> relationshipsFrom(String entityId);

    Optional<ReasoningTraceRow> reasoningTraceFor(String sourceEventId);

    List<EnrichmentRow> allEnrichments();

    List<RelationshipRow> allRelationships();

    List<ReasoningTraceRow> allReasoningTraces();
}
