package com.tessera.knowledgeservice.admin;

import com.tessera.security.ContextType;
import com.tessera.security.InMemoryMembershipDirectory;
import com.tessera.security.InMemoryWorkspaceDirectory;
import com.tessera.security.RoleMembership;
import com.tessera.security.WorkspaceRole;
import com.tessera.security.WorkspaceSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Maintains the workspace settings and role memberships the permission governor reads.
 *
 * <p>Membership management is not itself event-sourced; the directories are collaborators of the
 * pipeline, not aggregates of it.
 */
@RestController
@RequestMapping("/api/v1")
public class WorkspaceAdminController {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceAdminController.class);

    private final InMemoryWorkspaceDirectory workspaces;
    private final InMemoryMembershipDirectory memberships;

    public WorkspaceAdminController(
            InMemoryWorkspaceDirectory workspaces, InMemoryMembershipDirectory memberships) {
        this.workspaces = workspaces;
        this.memberships = memberships;
    }

    public record WorkspaceRequest(@NotBlank String ownerId, boolean aiAutoApprove) {}

    public record MemberRequest(@NotBlank String role) {}

    @PutMapping("/workspaces/{workspaceId}")
    public WorkspaceSettings putWorkspace(
            @PathVariable String workspaceId, @Valid @RequestBody WorkspaceRequest request) {
        var settings = new WorkspaceSettings(workspaceId, request.ownerId(), request.aiAutoApprove());
        workspaces.put(settings);
        log.info(
                "Workspace {} owned by {} (aiAutoApprove={})",
                workspaceId,
                request.ownerId(),
                request.aiAutoApprove());
        return settings;
    }

    @PutMapping("/workspaces/{workspaceId}/members/{userId}")
    public RoleMembership putWorkspaceMember(
            @PathVariable String workspaceId,
            @PathVariable String userId,
            @Valid @RequestBody MemberRequest request) {
        return grant(RoleMembership.workspace(workspaceId, userId, role(request)));
    }

    @DeleteMapping("/workspaces/{workspaceId}/members/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteWorkspaceMember(@PathVariable String workspaceId, @PathVariable String userId) {
        revoke(ContextType.WORKSPACE, workspaceId, userId);
    }

    @PutMapping("/projects/{projectId}/members/{userId}")
    public RoleMembership putProjectMember(
            @PathVariable String projectId,
            @PathVariable String userId,
            @Valid @RequestBody MemberRequest request) {
        return grant(RoleMembership.project(projectId, userId, role(request)));
    }

    @DeleteMapping("/projects/{projectId}/members/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteProjectMember(@PathVariable String projectId, @PathVariable String userId) {
        revoke(ContextType.PROJECT, projectId, userId);
    }

    private RoleMembership grant(RoleMembership membership) {
        memberships.grant(membership);
        log.info(
                "Granted {} on {} {} to {}",
                membership.role().value(),
                membership.contextType().value(),
                membership.contextId(),
                membership.userId());
        return membership;
    }

    private void revoke(ContextType type, String contextId, String userId) {
        memberships.revoke(type, contextId, userId);
        log.info("Revoked {} {} membership of {}", type.value(), contextId, userId);
    }

    private static WorkspaceRole role(MemberRequest request) {
        return WorkspaceRole.fromString(request.role())
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + request.role()));
    }
}
