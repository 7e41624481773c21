package com.tessera.security;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Outcome of a permission check, recorded in the triggering event's metadata under {@link
 * #METADATA_KEY}.
 *
 * @param granted whether the command may run now
 * @param needsApproval whether a human must approve first
 * @param approvers users allowed to approve; empty unless {@code needsApproval}
 * @param reason human-readable explanation
 * @param role role the decision was based on, if any
 * @param context level the role was resolved at, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionDecision(
        boolean granted,
        boolean needsApproval,
        List<String> approvers,
        String reason,
        WorkspaceRole role,
        ContextType context) {

    public static final String METADATA_KEY = "decision";

    public PermissionDecision {
        approvers = approvers == null ? List.of() : List.copyOf(approvers);
        if (granted && needsApproval) {
            throw new IllegalArgumentException("a decision cannot be granted and pending at once");
        }
    }

    public static PermissionDecision approved(String reason, WorkspaceRole role, ContextType context) {
        return new PermissionDecision(true, false, List.of(), reason, role, context);
    }

    public static PermissionDecision pending(List<String> approvers, String reason) {
        return new PermissionDecision(false, true, approvers, reason, null, null);
    }

    public static PermissionDecision denied(String reason) {
        return new PermissionDecision(false, false, List.of(), reason, null, null);
    }

    public static PermissionDecision denied(String reason, WorkspaceRole role, ContextType context) {
        return new PermissionDecision(false, false, List.of(), reason, role, context);
    }

    /** True for a final refusal: neither granted nor awaiting approval. */
    public boolean rejected() {
        return !granted && !needsApproval;
    }
}
