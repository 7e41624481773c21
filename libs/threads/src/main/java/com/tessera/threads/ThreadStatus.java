package com.tessera.threads;

import java.util.Arrays;
import java.util.Optional;

/** Lifecycle of a thread. Only {@link #ACTIVE} threads accept messages. */
public enum ThreadStatus {
    ACTIVE("active"),
    MERGED("merged"),
    ARCHIVED("archived");

    private final String value;

    ThreadStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ThreadStatus> fromString(String value) {
        return Arrays.stream(values()).filter(s -> s.value.equalsIgnoreCase(value)).findFirst();
    }
}
