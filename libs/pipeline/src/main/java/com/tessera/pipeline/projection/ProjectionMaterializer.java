package com.tessera.pipeline.projection;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.EventPhase;
import com.tessera.eventmodel.EventSerializer;
import com.tessera.eventstore.EventStore;
import com.tessera.eventstore.StoredEvent;
import com.tessera.pipeline.dispatch.EventHandler;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projects the AI provenance of completed events into the {@link ProjectionStore}.
 *
 * <p>Only events carrying an {@code ai} metadata block produce rows. All writes are
 * insert-if-absent, so live projection and {@link #rebuild(Optional)} can run side by side.
 */
public class ProjectionMaterializer implements EventHandler {

    public static final String NAME = "projection-materializer";
    public static final String PATTERN = "*.*.completed";

    private static final Logger log = LoggerFactory.getLogger(ProjectionMaterializer.class);

    private final EventStore events;
    private final ProjectionStore projections;

    public ProjectionMaterializer(EventStore events, ProjectionStore projections) {
        this.events = events;
        this.projections = projections;
    }

    @Override
    public Object handle(EventEnvelope event) {
        return project(event) ? "projected" : "no AI metadata";
    }

    /**
     * Projects one event.
     *
     * @return true when the event carried AI metadata
     * @throws IllegalArgumentException when the AI metadata is malformed
     */
    public boolean project(EventEnvelope event) {
        Optional<Object> raw = event.metadataValue("ai");
        if (raw.isEmpty() || !(raw.get() instanceof Map<?, ?>) && !(raw.get() instanceof AiMetadata)) {
            return false;
        }
        AiMetadata ai =
                raw.get() instanceof AiMetadata typed
                        ? typed
                        : EventSerializer.objectMapper().convertValue(raw.get(), AiMetadata.class);
        String entityId = event.subjectId();
        String eventId = event.id().toString();

        if (ai.extraction() != null) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("extractionMethod", ai.extraction().method());
            if (ai.extraction().extractedFrom() != null) {
                data.put("sourceMessageId", ai.extraction().extractedFrom().messageId());
                data.put("sourceThreadId", ai.extraction().extractedFrom().threadId());
                data.put("content", ai.extraction().extractedFrom().content());
            }
            projections.insertEnrichment(
                    new EnrichmentRow(
                            entityId, EnrichmentRow.Type.EXTRACTION, eventId, ai.agent(), ai.score(),
                            data, event.userId()));
        }

        if (ai.classification() != null) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("categories", ai.classification().categories());
            data.put("tags", ai.classification().tags());
            data.put("method", ai.classification().method());
            projections.insertEnrichment(
                    new EnrichmentRow(
                            entityId,
                            EnrichmentRow.Type.CLASSIFICATION,
                            eventId,
                            ai.agent(),
                            ai.classification().topConfidence(),
                            data,
                            event.userId()));
        }

        if (ai.inferredProperties() != null) {
            projections.insertEnrichment(
                    new EnrichmentRow(
                            entityId,
                            EnrichmentRow.Type.PROPERTIES,
                            eventId,
                            ai.agent(),
                            ai.score(),
                            Map.of("properties", ai.inferredProperties()),
                            event.userId()));
        }

        if (ai.relationships() != null) {
            for (AiMetadata.Relationships.Relationship rel : ai.relationships().relationships()) {
                projections.insertRelationship(
                        new RelationshipRow(
                                entityId, rel.targetEntityId(), rel.type(), eventId, ai.agent(),
                                rel.confidence(), event.userId()));
                if (rel.bidirectional()) {
                    projections.insertRelationship(
                            new RelationshipRow(
                                    rel.targetEntityId(), entityId, rel.type(), eventId, ai.agent(),
                                    rel.confidence(), event.userId()));
                }
            }
        }

        if (ai.reasoning() != null) {
            projections.insertReasoningTrace(
                    new ReasoningTraceRow(
                            event.subjectType(),
                            entityId,
                            eventId,
                            ai.agent(),
                            ai.reasoning().steps(),
                            ai.reasoning().outcome(),
                            ai.reasoning().durationMs(),
                            event.userId()));
        }

        log.info("Projected AI metadata of {} {} (agent {})", event.type(), eventId, ai.agent());
        return true;
    }

    /**
     * Replays completed events from the log, all of them or those at or after {@code from}.
     * Events that fail to project are counted and logged; the rebuild continues.
     */
    public RebuildReport rebuild(Optional<Instant> from) {
        log.info("Starting projection rebuild from {}", from.map(Instant::toString).orElse("the beginning"));
        int processed = 0;
        int projected = 0;
        int errors = 0;
        for (StoredEvent stored : events.readAll(from.orElse(Instant.EPOCH))) {
            EventEnvelope event = stored.event();
            if (event.phase() != EventPhase.COMPLETED) {
                continue;
            }
            processed++;
            try {
                if (project(event)) {
                    projected++;
                }
            } catch (RuntimeException e) {
                errors++;
                log.error("Could not project {} {}", event.type(), event.id(), e);
            }
        }
        log.info("Projection rebuild done: {} processed, {} projected, {} errors", processed, projected, errors);
        return new RebuildReport(processed, projected, errors);
    }
}
