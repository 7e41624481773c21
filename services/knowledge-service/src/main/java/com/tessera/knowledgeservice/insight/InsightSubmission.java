package com.tessera.knowledgeservice.insight;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An insight pushed by an intelligence service.
 *
 * @param correlationId must equal the request id the token was issued for
 * @param confidence overall confidence in [0, 1]
 * @param agent producing agent, {@code intelligence-hub} when absent
 * @param reasoning free-text explanation
 * @param actions commands the insight proposes; a null entry is kept so it is reported as a failed
 *     action at its own index
 */
public record InsightSubmission(
        String correlationId,
        Double confidence,
        String agent,
        String reasoning,
        List<Action> actions) {

    public static final String DEFAULT_AGENT = "intelligence-hub";

    public InsightSubmission {
        actions = actions == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(actions));
        if (agent == null || agent.isBlank()) {
            agent = DEFAULT_AGENT;
        }
    }

    /**
     * One proposed command.
     *
     * @param eventType a {@code .requested} event type
     * @param subjectId target aggregate, generated when absent
     * @param data command data
     * @param ai extra provenance (extraction, classification, relationships, reasoning, inferred
     *     properties) merged into the event's {@code ai} metadata
     */
    public record Action(
            String eventType, String subjectId, Map<String, Object> data, Map<String, Object> ai) {}
}
