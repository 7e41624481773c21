package com.tessera.pipeline.governor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A command waiting for a human decision.
 *
 * @param pendingEventId the {@code .pending} event
 * @param eventType its type
 * @param subjectId aggregate the command targets
 * @param requestedBy user the command was submitted for
 * @param approvers users allowed to decide
 * @param reason why review is needed
 * @param createdAt when the proposal was opened
 * @param status current state
 * @param decidedBy approver who decided, once decided
 */
public record Proposal(
        UUID pendingEventId,
        String eventType,
        String subjectId,
        String requestedBy,
        List<String> approvers,
        String reason,
        Instant createdAt,
        Status status,
        String decidedBy) {

    public enum Status {
        PENDING,
        APPROVED,
        REJECTED
    }

    public Proposal {
        approvers = approvers == null ? List.of() : List.copyOf(approvers);
    }

    public boolean canBeDecidedBy(String userId) {
        return approvers.contains(userId);
    }

    Proposal decided(Status newStatus, String approverId) {
        return new Proposal(
                pendingEventId, eventType, subjectId, requestedBy, approvers, reason, createdAt,
                newStatus, approverId);
    }
}
