package com.tessera.security;

/**
 * A user's role in one workspace or project.
 *
 * @param contextType workspace or project
 * @param contextId the workspace or project id
 * @param userId the member
 * @param role the role held there
 */
public record RoleMembership(
        ContextType contextType, String contextId, String userId, WorkspaceRole role) {

    public RoleMembership {
        if (contextType == null) {
            throw new IllegalArgumentException("contextType must not be null");
        }
        if (contextId == null || contextId.isBlank()) {
            throw new IllegalArgumentException("contextId must not be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    public static RoleMembership workspace(String workspaceId, String userId, WorkspaceRole role) {
        return new RoleMembership(ContextType.WORKSPACE, workspaceId, userId, role);
    }

    public static RoleMembership project(String projectId, String userId, WorkspaceRole role) {
        return new RoleMembership(ContextType.PROJECT, projectId, userId, role);
    }
}
