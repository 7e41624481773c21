package com.tessera.eventmodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * Where a command or event originated.
 *
 * <p>The permission governor treats {@link #INTELLIGENCE} differently from every other source: AI
 * originated commands may need a human approval before they run.
 */
public enum EventSource {
    USER("user"),
    AUTOMATION("automation"),
    SYNC("sync"),
    MIGRATION("migration"),
    SYSTEM("system"),
    INTELLIGENCE("intelligence");

    private final String value;

    EventSource(String value) {
        this.value = value;
    }

    /** The canonical string representation used in JSON (e.g. "intelligence"). */
    @JsonValue
    public String value() {
        return value;
    }

    /** True for commands proposed by an AI agent rather than a person or a sync job. */
    public boolean isAiOriginated() {
        return this == INTELLIGENCE;
    }

    /**
     * Looks up a source by its canonical string value, case-insensitively.
     *
     * @param value the string to match (e.g. "user")
     * @return the matching source, or empty if not found
     */
    public static Optional<EventSource> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (EventSource source : values()) {
            if (source.value.equalsIgnoreCase(value)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static EventSource fromJson(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event source: " + value));
    }
}
