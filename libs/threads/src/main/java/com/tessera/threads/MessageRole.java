package com.tessera.threads;

import java.util.Arrays;
import java.util.Optional;

public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant"),
    SYSTEM("system");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<MessageRole> fromString(String value) {
        return Arrays.stream(values()).filter(r -> r.value.equalsIgnoreCase(value)).findFirst();
    }
}
