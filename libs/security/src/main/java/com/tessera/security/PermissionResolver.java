package com.tessera.security;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves whether a user may perform an action inside a workspace, optionally scoped to projects.
 *
 * <p>Resolution order:
 *
 * <ol>
 *   <li>The action must map to a {@link Permission}; unknown actions are denied.
 *   <li>Workspace membership is always required.
 *   <li>With a project scope, membership in any of the projects takes precedence over the workspace
 *       role. A user in none of them passes only as workspace owner.
 *   <li>Without a project scope the workspace role decides.
 * </ol>
 */
public class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    private final MembershipDirectory memberships;

    public PermissionResolver(MembershipDirectory memberships) {
        this.memberships = memberships;
    }

    /** The result is always approved or denied, never pending. */
    public PermissionDecision resolve(
            String userId, String action, String workspaceId, List<String> projectIds) {
        Optional<Permission> required = Permission.forAction(action);
        if (required.isEmpty()) {
            return PermissionDecision.denied("unknown action: " + action);
        }
        Permission permission = required.get();

        Optional<RoleMembership> workspaceMember =
                memberships.find(ContextType.WORKSPACE, workspaceId, userId);
        if (workspaceMember.isEmpty()) {
            return PermissionDecision.denied(
                    "user is not a member of this workspace", null, ContextType.WORKSPACE);
        }
        WorkspaceRole workspaceRole = workspaceMember.get().role();

        if (projectIds != null && !projectIds.isEmpty()) {
            Optional<RoleMembership> projectMember =
                    projectIds.stream()
                            .map(projectId -> memberships.find(ContextType.PROJECT, projectId, userId))
                            .flatMap(Optional::stream)
                            .findFirst();
            if (projectMember.isPresent()) {
                WorkspaceRole projectRole = projectMember.get().role();
                return projectRole.grants(permission)
                        ? PermissionDecision.approved(
                                "project role " + projectRole.value(), projectRole, ContextType.PROJECT)
                        : PermissionDecision.denied(
                                "insufficient project permissions (role: " + projectRole.value() + ")",
                                projectRole,
                                ContextType.PROJECT);
            }
            if (workspaceRole == WorkspaceRole.OWNER) {
                log.debug("Workspace owner {} bypasses project scope {}", userId, projectIds);
                return PermissionDecision.approved(
                        "workspace owner", workspaceRole, ContextType.WORKSPACE);
            }
            return PermissionDecision.denied(
                    "user is not a member of any of the resource's projects",
                    workspaceRole,
                    ContextType.PROJECT);
        }

        return workspaceRole.grants(permission)
                ? PermissionDecision.approved(
                        "workspace role " + workspaceRole.value(), workspaceRole, ContextType.WORKSPACE)
                : PermissionDecision.denied(
                        "insufficient workspace permissions (role: " + workspaceRole.value() + ")",
                        workspaceRole,
                        ContextType.WORKSPACE);
    }
}
