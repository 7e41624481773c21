package com.tessera.security;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Capabilities a role can grant. */
public enum Permission {
    READ("read"),
    WRITE("write"),
    DELETE("delete"),
    MANAGE("manage"),
    INVITE("invite");

    private static final Map<String, Permission> BY_ACTION =
            Map.ofEntries(
                    Map.entry("read", READ),
                    Map.entry("list", READ),
                    Map.entry("create", WRITE),
                    Map.entry("update", WRITE),
                    Map.entry("delete", DELETE),
                    Map.entry("addMember", MANAGE),
                    Map.entry("removeMember", MANAGE),
                    Map.entry("updateMemberRole", MANAGE),
                    Map.entry("invite", INVITE));

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * The permission a command action requires, e.g. {@code create} requires {@link #WRITE}.
     * Unmapped actions return empty and must be denied by the caller.
     */
    public static Optional<Permission> forAction(String action) {
        return Optional.ofNullable(action).map(BY_ACTION::get);
    }

    public static Optional<Permission> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Permission permission : values()) {
            if (permission.value.equals(normalized)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }
}
