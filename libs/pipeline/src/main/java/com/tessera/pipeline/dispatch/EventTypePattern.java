package com.tessera.pipeline.dispatch;

import com.tessera.eventmodel.EventTypeName;

/**
 * Subscription pattern for event types: an exact type ({@code entities.create.validated}), a
 * per-segment wildcard ({@code *.*.requested}, {@code entities.*.validated}) or {@code *} for
 * everything.
 */
public record EventTypePattern(String subject, String action, String phase) {

    private static final String ANY = "*";

    public EventTypePattern {
        if (subject == null || action == null || phase == null) {
            throw new IllegalArgumentException("pattern segments must not be null");
        }
    }

    /**
     * Parses a pattern string.
     *
     * @throws IllegalArgumentException unless it is {@code *} or has exactly three non-empty
     *     segments
     */
    public static EventTypePattern parse(String pattern) {
        if (ANY.equals(pattern)) {
            return new EventTypePattern(ANY, ANY, ANY);
        }
        String[] parts = pattern == null ? new String[0] : pattern.split("\\.", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException(
                    "Pattern must be '*' or {subject}.{action}.{phase}: " + pattern);
        }
        for (String part : parts) {
            if (part.isBlank()) {
                throw new IllegalArgumentException("Pattern has an empty segment: " + pattern);
            }
        }
        return new EventTypePattern(parts[0], parts[1], parts[2]);
    }

    public boolean matches(EventTypeName type) {
        return segmentMatches(subject, type.subject())
                && segmentMatches(action, type.action())
                && segmentMatches(phase, type.phase().value());
    }

    private static boolean segmentMatches(String pattern, String value) {
        return ANY.equals(pattern) || pattern.equals(value);
    }

    @Override
    public String toString() {
        return subject + "." + action + "." + phase;
    }
}
