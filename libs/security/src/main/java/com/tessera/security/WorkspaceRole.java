package com.tessera.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Roles a user holds in a workspace or project.
 *
 * <p>WHY an enum with a fixed permission set: the role matrix is encoded once here instead of being
 * re-derived by every caller, and the same matrix applies at workspace and project level.
 */
public enum WorkspaceRole {
    OWNER("owner"),
    EDITOR("editor"),
    VIEWER("viewer");

    private final String value;

    WorkspaceRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Permissions this role grants.
     *
     * <ul>
     *   <li>OWNER: read, write, delete, manage, invite
     *   <li>EDITOR: read, write
     *   <li>VIEWER: read
     * </ul>
     */
    public Set<Permission> permissions() {
        return switch (this) {
            case OWNER -> EnumSet.allOf(Permission.class);
            case EDITOR -> EnumSet.of(Permission.READ, Permission.WRITE);
            case VIEWER -> EnumSet.of(Permission.READ);
        };
    }

    public boolean grants(Permission permission) {
        return permissions().contains(permission);
    }

    /** Case-insensitive lookup by canonical value ("owner", "editor", "viewer"). */
    public static Optional<WorkspaceRole> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (WorkspaceRole role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static WorkspaceRole fromJson(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }
}
