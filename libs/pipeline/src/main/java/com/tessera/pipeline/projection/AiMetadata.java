package com.tessera.pipeline.projection;

import java.util.List;
import java.util.Map;

/**
 * AI provenance attached to an event under metadata key {@code ai}. Every part is optional.
 *
 * @param agent agent that produced the command
 * @param confidence overall confidence
 * @param extraction where the content was extracted from
 * @param classification categories and tags assigned
 * @param relationships links to other entities
 * @param reasoning the agent's reasoning trace
 * @param inferredProperties properties the agent inferred
 */
public record AiMetadata(
        String agent,
        Confidence confidence,
        Extraction extraction,
        Classification classification,
        Relationships relationships,
        Reasoning reasoning,
        Map<String, Object> inferredProperties) {

    /** Fallback when an agent reports no score. */
    public static final double DEFAULT_CONFIDENCE = 0.5;

    public record Confidence(Double score, String reasoning) {}

    public record Extraction(String method, Source extractedFrom) {

        public record Source(String messageId, String threadId, String content) {}
    }

    public record Classification(List<Category> categories, List<String> tags, String method) {

        public record Category(String name, double confidence) {}

        public Classification {
            categories = categories == null ? List.of() : List.copyOf(categories);
            tags = tags == null ? List.of() : List.copyOf(tags);
        }

        /** Highest category confidence, 0 without categories. */
        public double topConfidence() {
            return categories.stream().mapToDouble(Category::confidence).max().orElse(0);
        }
    }

    public record Relationships(List<Relationship> relationships) {

        public record Relationship(
                String targetEntityId, String type, double confidence, boolean bidirectional) {

            public Relationship {
                if (targetEntityId == null || targetEntityId.isBlank()) {
                    throw new IllegalArgumentException("relationship targetEntityId must not be blank");
                }
            }
        }

        public Relationships {
            relationships = relationships == null ? List.of() : List.copyOf(relationships);
        }
    }

    public record Reasoning(List<Map<String, Object>> steps, Map<String, Object> outcome, Long durationMs) {}

    public double score() {
        return confidence != null && confidence.score() != null ? confidence.score() : DEFAULT_CONFIDENCE;
    }
}
