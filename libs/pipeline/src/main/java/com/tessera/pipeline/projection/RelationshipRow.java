package com.tessera.pipeline.projection;

/** A directed link between two entities proposed by an agent. */
public record RelationshipRow(
        String sourceEntityId,
        String targetEntityId,
        String relationshipType,
        String sourceEventId,
        String agentId,
        double confidence,
        String userId) {}
