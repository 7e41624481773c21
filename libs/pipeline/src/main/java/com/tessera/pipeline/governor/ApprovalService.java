package com.tessera.pipeline.governor;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.EventFactory;
import com.tessera.eventmodel.EventPhase;
import com.tessera.eventmodel.EventSource;
import com.tessera.eventstore.StoredEvent;
import com.tessera.eventstore.UnknownEventException;
import com.tessera.observability.MetricFactory;
import com.tessera.pipeline.dispatch.EventHandler;
import com.tessera.pipeline.publish.EventPublisher;
import com.tessera.security.PermissionDecision;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Human decisions on pending commands.
 *
 * <p>Subscribes to {@code *.*.pending} to keep an index of open proposals. Approving re-submits the
 * command as a new {@code .requested} event acted on by the approver as a person, so it passes
 * through the governor again with the approver's own permissions. Rejecting emits {@code .denied}.
 *
 * <p>A decision is claimed before its event is published; when publishing fails the claim is
 * released so the proposal can be decided again. The {@code tessera.approvals.pending} gauge tracks
 * open proposals.
 */
public class ApprovalService implements EventHandler {

    public static final String NAME = "approval-index";
    public static final String PATTERN = "*.*.pending";

    static final String APPROVAL_KEY = "approval";

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    private final EventFactory factory;
    private final EventPublisher publisher;
    private final Map<UUID, Proposal> proposals = new ConcurrentHashMap<>();
    private final AtomicLong pendingGauge;

    public ApprovalService(EventFactory factory, EventPublisher publisher, MetricFactory metrics) {
        this.factory = factory;
        this.publisher = publisher;
        this.pendingGauge = metrics.gauge("approvals.pending", "Proposals awaiting a human decision");
    }

    @Override
    public Object handle(EventEnvelope event) {
        if (event.phase() != EventPhase.PENDING) {
            return "ignored: not a pending event";
        }
        PermissionDecision decision =
                DecisionMetadata.fromEvent(event)
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "Pending event " + event.id() + " has no decision"));
        proposals.putIfAbsent(
                event.id(),
                new Proposal(
                        event.id(),
                        event.type().value(),
                        event.subjectId(),
                        event.userId(),
                        decision.approvers(),
                        decision.reason(),
                        event.timestamp(),
                        Proposal.Status.PENDING,
                        null));
        refreshPendingCount();
        log.info("Proposal {} opened for {} awaiting {}", event.id(), event.type(), decision.approvers());
        return "proposal opened";
    }

    /** Open proposals {@code userId} may decide, oldest first. */
    public List<Proposal> listPending(String userId) {
        return proposals.values().stream()
                .filter(p -> p.status() == Proposal.Status.PENDING)
                .filter(p -> p.canBeDecidedBy(userId))
                .sorted(Comparator.comparing(Proposal::createdAt))
                .toList();
    }

    /**
     * Approves a pending command by re-submitting it as {@code approverId}.
     *
     * @return the new requested event
     * @throws UnknownEventException when there is no such proposal
     * @throws NotAnApproverException when {@code approverId} is not listed
     * @throws IllegalStateException when the proposal was already decided
     */
    public EventEnvelope approve(UUID pendingEventId, String approverId) {
        Proposal proposal = claim(pendingEventId, approverId, Proposal.Status.APPROVED);
        EventEnvelope resubmitted;
        try {
            resubmitted = publishApproval(pendingEventId, approverId, proposal);
        } catch (RuntimeException e) {
            release(proposal, approverId, Proposal.Status.APPROVED, e);
            throw e;
        }
        log.info("Proposal {} approved by {} as {}", pendingEventId, approverId, resubmitted.id());
        return resubmitted;
    }

    private EventEnvelope publishApproval(UUID pendingEventId, String approverId, Proposal proposal) {
        EventEnvelope pending = load(pendingEventId);
        var metadata = new LinkedHashMap<>(pending.metadata());
        metadata.remove(PermissionDecision.METADATA_KEY);
        metadata.put(
                APPROVAL_KEY,
                Map.of(
                        "approvedBy", approverId,
                        "pendingEventId", pendingEventId.toString(),
                        "proposedBy", String.valueOf(proposal.requestedBy())));
        EventEnvelope resubmitted =
                factory.createChild(pending, EventPhase.REQUESTED, metadata, approverId, EventSource.USER);
        publisher.publish(resubmitted);
        return resubmitted;
    }

    /**
     * Rejects a pending command.
     *
     * @return the denied event
     */
    public EventEnvelope reject(UUID pendingEventId, String approverId, String reason) {
        Proposal proposal = claim(pendingEventId, approverId, Proposal.Status.REJECTED);
        EventEnvelope denied;
        try {
            denied = publishRejection(pendingEventId, approverId, reason);
        } catch (RuntimeException e) {
            release(proposal, approverId, Proposal.Status.REJECTED, e);
            throw e;
        }
        log.info("Proposal {} rejected by {}", pendingEventId, approverId);
        return denied;
    }

    private EventEnvelope publishRejection(UUID pendingEventId, String approverId, String reason) {
        EventEnvelope pending = load(pendingEventId);
        String why = reason == null || reason.isBlank() ? "rejected" : "rejected: " + reason;
        var metadata = new LinkedHashMap<>(pending.metadata());
        metadata.put(
                PermissionDecision.METADATA_KEY,
                DecisionMetadata.toMetadata(PermissionDecision.denied(why)));
        metadata.put(APPROVAL_KEY, Map.of("rejectedBy", approverId));
        EventEnvelope denied =
                factory.createChild(pending, EventPhase.DENIED, metadata, approverId, EventSource.USER);
        publisher.publish(denied);
        return denied;
    }

    /**
     * Rebuilds the proposal index from the store: every pending event not yet followed by a
     * decision.
     *
     * @return number of open proposals after the rebuild
     */
    public int recover() {
        for (StoredEvent stored : publisher.store().readAll(Instant.EPOCH)) {
            EventEnvelope event = stored.event();
            if (event.phase() == EventPhase.PENDING
                    && !proposals.containsKey(event.id())
                    && !isDecided(event)) {
                handle(event);
            }
        }
        return (int) refreshPendingCount();
    }

    private boolean isDecided(EventEnvelope pending) {
        String id = pending.id().toString();
        return publisher.store().getCorrelatedEvents(pending.correlationId()).stream()
                .anyMatch(s -> id.equals(s.event().causationId()));
    }

    private Proposal claim(UUID pendingEventId, String approverId, Proposal.Status outcome) {
        Proposal current = proposals.get(pendingEventId);
        if (current == null) {
            throw new UnknownEventException(pendingEventId);
        }
        if (!current.canBeDecidedBy(approverId)) {
            throw new NotAnApproverException(pendingEventId, approverId);
        }
        if (current.status() != Proposal.Status.PENDING
                || !proposals.replace(pendingEventId, current, current.decided(outcome, approverId))) {
            throw new IllegalStateException("Proposal " + pendingEventId + " was already decided");
        }
        refreshPendingCount();
        return current;
    }

    /** Puts a claimed proposal back to pending after its decision could not be published. */
    private void release(Proposal claimed, String approverId, Proposal.Status outcome, RuntimeException cause) {
        UUID id = claimed.pendingEventId();
        if (proposals.replace(id, claimed.decided(outcome, approverId), claimed)) {
            log.warn("Proposal {} reopened, {} by {} was not published: {}",
                    id, outcome, approverId, cause.getMessage());
        }
        refreshPendingCount();
    }

    private long refreshPendingCount() {
        long open = proposals.values().stream().filter(p -> p.status() == Proposal.Status.PENDING).count();
        pendingGauge.set(open);
        return open;
    }

    private EventEnvelope load(UUID eventId) {
        return publisher.store()
                .findById(eventId)
                .map(StoredEvent::event)
                .orElseThrow(() -> new UnknownEventException(eventId));
    }
}
