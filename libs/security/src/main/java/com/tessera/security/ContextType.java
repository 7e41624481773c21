package com.tessera.security;

import com.fasterxml.jackson.annotation.JsonValue;

/** Level at which a membership or decision applies. */
public enum ContextType {
    WORKSPACE("workspace"),
    PROJECT("project");

    private final String value;

    ContextType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
