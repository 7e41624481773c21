package com.tessera.knowledgeservice.api;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.knowledgeservice.infrastructure.web.RequestHeaders;
import com.tessera.pipeline.governor.ApprovalService;
import com.tessera.pipeline.governor.Proposal;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Human review of AI proposals held in the pending phase. */
@RestController
@RequestMapping("/api/v1/approvals")
public class ApprovalController {

    private final ApprovalService approvals;

    public ApprovalController(ApprovalService approvals) {
        this.approvals = approvals;
    }

    public record RejectRequest(String reason) {}

    /** The event a decision produced: the re-submitted command or the denial. */
    public record DecisionResponse(UUID id, String type, String correlationId) {

        static DecisionResponse of(EventEnvelope event) {
            return new DecisionResponse(event.id(), event.type().value(), event.correlationId());
        }
    }

    @GetMapping
    public List<Proposal> pending(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        return approvals.listPending(userId);
    }

    @PostMapping("/{eventId}/approve")
    public DecisionResponse approve(
            @PathVariable UUID eventId, @RequestHeader(RequestHeaders.USER_ID) String userId) {
        return DecisionResponse.of(approvals.approve(eventId, userId));
    }

    @PostMapping("/{eventId}/reject")
    public DecisionResponse reject(
            @PathVariable UUID eventId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestBody(required = false) RejectRequest request) {
        return DecisionResponse.of(
                approvals.reject(eventId, userId, request == null ? null : request.reason()));
    }
}
