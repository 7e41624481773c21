package com.tessera.pipeline.governor;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.EventFactory;
import com.tessera.eventmodel.EventPhase;
import com.tessera.eventmodel.payload.CommandPayload;
import com.tessera.eventmodel.payload.EventPayload;
import com.tessera.eventmodel.payload.UnvalidatedPayload;
import com.tessera.eventstore.StoredEvent;
import com.tessera.observability.MetricFactory;
import com.tessera.pipeline.dispatch.EventHandler;
import com.tessera.pipeline.publish.EventPublisher;
import com.tessera.security.PermissionDecision;
import com.tessera.security.PermissionResolver;
import com.tessera.security.WorkspaceDirectory;
import com.tessera.security.WorkspaceSettings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides every {@code *.*.requested} command and moves it to validated, pending or denied.
 *
 * <p>Decision order:
 *
 * <ol>
 *   <li>No acting user: denied.
 *   <li>AI-originated and the workspace does not auto-approve AI: pending, approvable by the
 *       workspace owner (by the acting user for personal resources).
 *   <li>No workspace: a personal resource, approved. Ownership is enforced by the worker's row
 *       scoping.
 *   <li>Otherwise the {@link PermissionResolver} decides from workspace and project roles.
 * </ol>
 *
 * <p>The decision is annotated onto the requested event and copied into the phase event's
 * metadata. Redelivery of the same requested event emits nothing new: the phase event's id is
 * derived from the requested event's id, so concurrent deliveries append one event between them and
 * only the first one dispatches it.
 */
public class PermissionGovernor implements EventHandler {

    public static final String NAME = "permission-governor";
    public static final String PATTERN = "*.*.requested";

    /** Role of the phase event in {@link EventFactory#followUpId(java.util.UUID, String)}. */
    static final String DECISION_ROLE = "decision";

    private static final Logger log = LoggerFactory.getLogger(PermissionGovernor.class);

    private final EventFactory factory;
    private final EventPublisher publisher;
    private final PermissionResolver resolver;
    private final WorkspaceDirectory workspaces;
    private final MetricFactory metrics;

    public PermissionGovernor(
            EventFactory factory,
            EventPublisher publisher,
            PermissionResolver resolver,
            WorkspaceDirectory workspaces,
            MetricFactory metrics) {
        this.factory = factory;
        this.publisher = publisher;
        this.resolver = resolver;
        this.workspaces = workspaces;
        this.metrics = metrics;
    }

    @Override
    public Object handle(EventEnvelope event) {
        if (event.phase() != EventPhase.REQUESTED) {
            return "ignored: not a requested event";
        }
        Optional<StoredEvent> existing = findTransition(event);
        if (existing.isPresent()) {
            log.info(
                    "Requested event {} already transitioned to {}",
                    event.id(),
                    existing.get().event().type());
            return "already decided: " + existing.get().event().type().phase().value();
        }

        PermissionDecision decision = decide(event);
        EventPhase next = phaseFor(decision);
        Map<String, Object> recorded = DecisionMetadata.toMetadata(decision);

        publisher.store().annotate(event.id(), PermissionDecision.METADATA_KEY, recorded);

        var metadata = new LinkedHashMap<>(event.metadata());
        metadata.put(PermissionDecision.METADATA_KEY, recorded);
        EventEnvelope transition =
                factory.createChild(
                        EventFactory.followUpId(event.id(), DECISION_ROLE), event, next, metadata);
        EventPublisher.Publication publication = publisher.publish(transition);
        if (!publication.appended()) {
            String phase = publication.event().type().phase().value();
            log.info("Requested event {} was decided by a concurrent delivery: {}", event.id(), phase);
            return "already decided: " + phase;
        }

        metrics.counter(
                        "governor.decisions",
                        "Permission decisions by outcome",
                        "command", event.type().command(),
                        "outcome", next.value())
                .increment();
        if (next == EventPhase.DENIED) {
            log.warn("Denied {} {} for {}: {}", event.type(), event.id(), event.userId(), decision.reason());
        } else {
            log.info("{} {} {} for {}", next.value(), event.type(), event.id(), event.userId());
        }
        return next.value();
    }

    /** Pure decision for a requested event; reads settings and memberships but writes nothing. */
    public PermissionDecision decide(EventEnvelope event) {
        String userId = event.userId();
        if (userId == null || userId.isBlank()) {
            return PermissionDecision.denied("no user context");
        }

        String workspaceId = workspaceOf(event.data());
        List<String> projectIds = projectsOf(event.data());

        if (event.source().isAiOriginated()) {
            if (workspaceId == null) {
                return PermissionDecision.pending(
                        List.of(userId), "AI proposal on a personal resource requires review");
            }
            Optional<WorkspaceSettings> settings = workspaces.find(workspaceId);
            if (settings.isEmpty()) {
                return PermissionDecision.denied("unknown workspace: " + workspaceId);
            }
            if (!settings.get().aiAutoApprove()) {
                return PermissionDecision.pending(
                        List.of(settings.get().ownerId()), "AI proposal requires review");
            }
        }

        if (workspaceId == null) {
            return PermissionDecision.approved("personal-resource", null, null);
        }
        return resolver.resolve(userId, event.type().action(), workspaceId, projectIds);
    }

    private Optional<StoredEvent> findTransition(EventEnvelope requested) {
        String id = requested.id().toString();
        return publisher.store().getCorrelatedEvents(requested.correlationId()).stream()
                .filter(stored -> id.equals(stored.event().causationId()))
                .filter(stored -> stored.event().type().command().equals(requested.type().command()))
                .filter(stored -> isDecisionPhase(stored.event().phase()))
                .findFirst();
    }

    private static boolean isDecisionPhase(EventPhase phase) {
        return phase == EventPhase.VALIDATED || phase == EventPhase.PENDING || phase == EventPhase.DENIED;
    }

    private static EventPhase phaseFor(PermissionDecision decision) {
        if (decision.granted()) {
            return EventPhase.VALIDATED;
        }
        return decision.needsApproval() ? EventPhase.PENDING : EventPhase.DENIED;
    }

    private static String workspaceOf(EventPayload data) {
        if (data instanceof CommandPayload command) {
            return blankToNull(command.workspaceId());
        }
        if (data instanceof UnvalidatedPayload raw && raw.raw().get("workspaceId") instanceof String ws) {
            return blankToNull(ws);
        }
        return null;
    }

    private static List<String> projectsOf(EventPayload data) {
        if (data instanceof CommandPayload command) {
            return command.projectIds();
        }
        if (data instanceof UnvalidatedPayload raw && raw.raw().get("projectIds") instanceof List<?> ids) {
            return ids.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
