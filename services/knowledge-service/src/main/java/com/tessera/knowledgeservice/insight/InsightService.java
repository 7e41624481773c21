package com.tessera.knowledgeservice.insight;

import com.tessera.eventmodel.EventInput;
import com.tessera.eventmodel.EventPhase;
import com.tessera.eventmodel.EventSource;
import com.tessera.eventmodel.EventTypeName;
import com.tessera.eventmodel.SchemaValidationException;
import com.tessera.observability.MetricFactory;
import com.tessera.pipeline.publish.CommandSubmitter;
import com.tessera.pipeline.publish.SubmissionReceipt;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns insight actions into {@link EventSource#INTELLIGENCE} commands. They then go through the
 * governor like any AI command, so outside auto-approving workspaces they wait for a person.
 */
@Service
public class InsightService {

    private static final Logger log = LoggerFactory.getLogger(InsightService.class);

    static final String AI_METADATA_KEY = "ai";

    private final CommandSubmitter submitter;
    private final MetricFactory metrics;

    public InsightService(CommandSubmitter submitter, MetricFactory metrics) {
        this.submitter = submitter;
        this.metrics = metrics;
    }

    /**
     * @throws IllegalArgumentException when the correlation id is not the token's request id, or the
     *     confidence is outside [0, 1]
     */
    public InsightResult submit(InsightToken token, InsightSubmission insight) {
        if (!token.requestId().equals(insight.correlationId())) {
            metrics.counter(
                            "insights.rejected",
                            "Insights refused before publishing",
                            "reason", "correlation")
                    .increment();
            throw new IllegalArgumentException(
                    "Correlation id mismatch: expected "
                            + token.requestId()
                            + ", got "
                            + insight.correlationId());
        }
        if (insight.confidence() != null && (insight.confidence() < 0 || insight.confidence() > 1)) {
            throw new IllegalArgumentException("confidence must be within [0, 1]");
        }

        List<UUID> eventIds = new ArrayList<>();
        List<InsightResult.ActionFailure> failures = new ArrayList<>();
        List<InsightSubmission.Action> actions = insight.actions();
        for (int i = 0; i < actions.size(); i++) {
            InsightSubmission.Action action = actions.get(i);
            try {
                eventIds.add(publish(token, insight, action));
            } catch (SchemaValidationException | IllegalArgumentException e) {
                log.warn(
                        "Insight action {} of request {} rejected: {}",
                        i,
                        token.requestId(),
                        e.getMessage());
                failures.add(new InsightResult.ActionFailure(i, e.getMessage()));
            }
        }
        metrics.counter("insights.actions", "Insight actions published", "agent", insight.agent())
                .increment(eventIds.size());
        log.info(
                "Insight from {} for request {}: {} events published, {} failures",
                insight.agent(),
                token.requestId(),
                eventIds.size(),
                failures.size());
        return new InsightResult(eventIds.size(), eventIds, failures);
    }

    private UUID publish(
            InsightToken token, InsightSubmission insight, InsightSubmission.Action action) {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        EventTypeName type =
                EventTypeName.tryParse(action.eventType())
                        .filter(t -> t.phase() == EventPhase.REQUESTED)
                        .orElseThrow(
                                () -> new IllegalArgumentException(
                                        "Not a requested event type: " + action.eventType()));
        EventInput input =
                EventInput.of(type, token.userId(), action.data() == null ? Map.of() : action.data())
                        .withSubject(action.subjectId(), null)
                        .withSource(EventSource.INTELLIGENCE)
                        .withMetadata(Map.of(AI_METADATA_KEY, aiMetadata(insight, action)))
                        .withCorrelation(insight.correlationId(), null)
                        .withRequestId(token.requestId());
        SubmissionReceipt receipt = submitter.submit(input);
        return receipt.id();
    }

    static Map<String, Object> aiMetadata(InsightSubmission insight, InsightSubmission.Action action) {
        Map<String, Object> ai = new LinkedHashMap<>();
        if (action.ai() != null) {
            ai.putAll(action.ai());
        }
        ai.put("agent", insight.agent());
        Map<String, Object> confidence = new LinkedHashMap<>();
        Optional.ofNullable(insight.confidence()).ifPresent(score -> confidence.put("score", score));
        Optional.ofNullable(insight.reasoning()).ifPresent(why -> confidence.put("reasoning", why));
        ai.put("confidence", confidence);
        return ai;
    }
}
