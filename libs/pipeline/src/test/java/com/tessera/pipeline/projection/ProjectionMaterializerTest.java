package com.tessera.pipeline.projection;

import static com.tessera.pipeline.PipelineFixture.command;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.EventPhase;
import com.tessera.eventmodel.payload.EntityCompletedPayload;
import com.tessera.pipeline.PipelineFixture;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ProjectionMaterializer")
class ProjectionMaterializerTest {

    private final PipelineFixture pipeline = new PipelineFixture();
    private final String target = UUID.randomUUID().toString();

    private Map<String, Object> fullAi() {
        return Map.of(
                "agent", "librarian",
                "confidence", Map.of("score", 0.8),
                "extraction",
                        Map.of(
                                "method", "llm",
                                "extractedFrom", Map.of("messageId", "m1", "threadId", "t1", "content", "buy milk")),
                "inferredProperties", Map.of("priority", "low"),
                "relationships",
                        Map.of(
                                "relationships",
                                List.of(
                                        Map.of(
                                                "targetEntityId", target,
                                                "type", "related_to",
                                                "confidence", 0.7,
                                                "bidirectional", true))),
                "reasoning",
                        Map.of(
                                "steps", List.of(Map.of("thought", "user mentioned milk")),
                                "outcome", Map.of("action", "create"),
                                "durationMs", 120));
    }

    private EventEnvelope completeWith(Map<String, Object> ai) {
        var receipt =
                pipeline.submitter.submit(
                        command("entities.create.requested", "alice", Map.of("entityType", "note"))
                                .withMetadata(Map.of("ai", ai)));
        return pipeline.single(receipt.correlationId(), "entities.create.completed");
    }

    @Nested
    @DisplayName("live projection")
    class Live {

        @Test
        @DisplayName("writes enrichments, both relationship directions and the reasoning trace")
        void projectsEverything() {
            EventEnvelope completed = completeWith(fullAi());
            String entityId = completed.subjectId();

            assertThat(pipeline.projections.enrichmentsFor(entityId))
                    .extracting(EnrichmentRow::enrichmentType)
                    .containsExactlyInAnyOrder(EnrichmentRow.Type.EXTRACTION, EnrichmentRow.Type.PROPERTIES);
            assertThat(pipeline.projections.enrichmentsFor(entityId))
                    .allSatisfy(row -> assertThat(row.confidence()).isEqualTo(0.8));
            assertThat(pipeline.projections.relationshipsFrom(entityId))
                    .singleElement()
                    .satisfies(rel -> assertThat(rel.targetEntityId()).isEqualTo(target));
            assertThat(pipeline.projections.relationshipsFrom(target))
                    .singleElement()
                    .satisfies(rel -> assertThat(rel.targetEntityId()).isEqualTo(entityId));
            assertThat(pipeline.projections.reasoningTraceFor(completed.id().toString()))
                    .hasValueSatisfying(trace -> assertThat(trace.durationMs()).isEqualTo(120L));
        }

        @Test
        @DisplayName("defaults the confidence when the agent gives none")
        void defaultConfidence() {
            EventEnvelope completed = completeWith(Map.of("agent", "a", "inferredProperties", Map.of("k", "v")));

            assertThat(pipeline.projections.enrichmentsFor(completed.subjectId()))
                    .singleElement()
                    .satisfies(row -> assertThat(row.confidence()).isEqualTo(AiMetadata.DEFAULT_CONFIDENCE));
        }

        @Test
        @DisplayName("events without AI metadata produce nothing")
        void noAi() {
            pipeline.submitter.submit(command("entities.create.requested", "alice", Map.of("entityType", "note")));

            assertThat(pipeline.projections.allEnrichments()).isEmpty();
        }
    }

    @Nested
    @DisplayName("rebuild")
    class Rebuild {

        @Test
        @DisplayName("is idempotent: running it twice yields the same rows")
        void twice() {
            completeWith(fullAi());
            var enrichments = pipeline.projections.allEnrichments();
            var relationships = pipeline.projections.allRelationships();

            RebuildReport first = pipeline.materializer.rebuild(Optional.empty());
            RebuildReport second = pipeline.materializer.rebuild(Optional.empty());

            assertThat(first).isEqualTo(second);
            assertThat(first.processed()).isEqualTo(1);
            assertThat(first.projected()).isEqualTo(1);
            assertThat(pipeline.projections.allEnrichments()).isEqualTo(enrichments);
            assertThat(pipeline.projections.allRelationships()).isEqualTo(relationships);
        }

        @Test
        @DisplayName("regenerates rows into an empty store")
        void fromScratch() {
            completeWith(fullAi());
            var empty = new InMemoryProjectionStore();

            RebuildReport report = new ProjectionMaterializer(pipeline.store, empty).rebuild(Optional.empty());

            assertThat(report.projected()).isEqualTo(1);
            assertThat(empty.allEnrichments()).hasSameSizeAs(pipeline.projections.allEnrichments());
            assertThat(empty.allRelationships()).hasSize(2);
            assertThat(empty.allReasoningTraces()).hasSize(1);
        }

        @Test
        @DisplayName("honours the start timestamp")
        void fromTimestamp() {
            completeWith(fullAi());

            RebuildReport report =
                    pipeline.materializer.rebuild(Optional.of(Instant.now().plusSeconds(60)));

            assertThat(report.processed()).isZero();
        }

        @Test
        @DisplayName("counts events whose metadata cannot be read and carries on")
        void errorsCounted() {
            var requested =
                    pipeline.factory.createEvent(
                            command("entities.create.requested", "alice", Map.of("entityType", "note")));
            var validated = pipeline.factory.createChild(requested, EventPhase.VALIDATED);
            pipeline.store.append(
                    pipeline.factory.derive(
                            validated,
                            validated.type().withPhase(EventPhase.COMPLETED),
                            UUID.randomUUID().toString(),
                            new EntityCompletedPayload(
                                    UUID.randomUUID().toString(), "note", null, null, null, null, null, 1L),
                            Map.of("ai", Map.of("confidence", Map.of("score", "not a number")))));
            completeWith(fullAi());

            RebuildReport report = pipeline.materializer.rebuild(Optional.empty());

            assertThat(report.processed()).isEqualTo(2);
            assertThat(report.projected()).isEqualTo(1);
            assertThat(report.errors()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("live projection rejects unreadable AI metadata")
    void unreadable() {
        var requested =
                pipeline.factory.createEvent(
                        command("entities.create.requested", "alice", Map.of("entityType", "note")));
        var event =
                pipeline.factory.derive(
                        requested,
                        requested.type().withPhase(EventPhase.COMPLETED),
                        UUID.randomUUID().toString(),
                        new EntityCompletedPayload(
                                UUID.randomUUID().toString(), "note", null, null, null, null, null, 1L),
                        Map.of("ai", Map.of("confidence", Map.of("score", "not a number"))));

        assertThatThrownBy(() -> pipeline.materializer.project(event))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("a relationship without a target is rejected before any row is written")
    void relationshipWithoutTarget() {
        var requested =
                pipeline.factory.createEvent(
                        command("entities.create.requested", "alice", Map.of("entityType", "note")));
        var relationship = new HashMap<String, Object>();
        relationship.put("targetEntityId", null);
        relationship.put("type", "related_to");
        relationship.put("bidirectional", true);
        var event =
                pipeline.factory.derive(
                        requested,
                        requested.type().withPhase(EventPhase.COMPLETED),
                        UUID.randomUUID().toString(),
                        new EntityCompletedPayload(
                                UUID.randomUUID().toString(), "note", null, null, null, null, null, 1L),
                        Map.of(
                                "ai",
                                Map.of(
                                        "inferredProperties", Map.of("k", "v"),
                                        "relationships", Map.of("relationships", List.of(relationship)))));

        assertThatThrownBy(() -> pipeline.materializer.project(event))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("targetEntityId");
        assertThat(pipeline.projections.allEnrichments()).isEmpty();
        assertThat(pipeline.projections.allRelationships()).isEmpty();
        assertThat(pipeline.projections.relationshipsFrom("anything")).isEmpty();
    }
}
