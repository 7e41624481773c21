package com.tessera.security;

/**
 * Per-workspace settings the governor consults.
 *
 * @param workspaceId the workspace
 * @param ownerId user who approves AI proposals
 * @param aiAutoApprove whether AI-originated commands run without a human approval
 */
public record WorkspaceSettings(String workspaceId, String ownerId, boolean aiAutoApprove) {

    public WorkspaceSettings {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId must not be null or blank");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be null or blank");
        }
    }
}
