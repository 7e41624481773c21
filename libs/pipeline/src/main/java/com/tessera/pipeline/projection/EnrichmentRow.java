package com.tessera.pipeline.projection;

import java.util.Map;

/** One AI enrichment of an entity, derived from a single event. */
public record EnrichmentRow(
        String entityId,
        Type enrichmentType,
        String sourceEventId,
        String agentId,
        double confidence,
        Map<String, Object> data,
        String userId) {

    public enum Type {
        EXTRACTION,
        CLASSIFICATION,
        PROPERTIES
    }
}
