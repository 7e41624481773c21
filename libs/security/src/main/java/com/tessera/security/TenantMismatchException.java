package com.tessera.security;

/**
 * Thrown when a command reaches a row owned by a different user or workspace.
 *
 * <p>WHY a RuntimeException: a tenant mismatch is never recoverable by retrying. Fail fast and
 * loud.
 */
public class TenantMismatchException extends RuntimeException {

    private final String resourceId;

    public TenantMismatchException(String resourceId, String detail) {
        super("Resource '%s' is outside the caller's scope: %s".formatted(resourceId, detail));
        this.resourceId = resourceId;
    }

    public String resourceId() {
        return resourceId;
    }
}
