package com.tessera.security;

import java.util.Objects;

/**
 * Row-scoped tenant isolation: a workspace row is visible only through its own workspace, a
 * personal row only to its owner.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that a caller acting as {@code userId} in {@code workspaceId} (null for personal
     * scope) may touch a row owned by {@code ownerId} in {@code rowWorkspaceId}.
     *
     * @throws TenantMismatchException if the row belongs to another tenant
     */
    public static void enforce(
            String resourceId,
            String userId,
            String workspaceId,
            String ownerId,
            String rowWorkspaceId) {
        if (rowWorkspaceId != null) {
            if (!rowWorkspaceId.equals(workspaceId)) {
                throw new TenantMismatchException(
                        resourceId, "belongs to workspace " + rowWorkspaceId);
            }
            return;
        }
        if (workspaceId != null) {
            throw new TenantMismatchException(resourceId, "is a personal resource");
        }
        if (!Objects.equals(ownerId, userId)) {
            throw new TenantMismatchException(resourceId, "is owned by another user");
        }
    }
}
