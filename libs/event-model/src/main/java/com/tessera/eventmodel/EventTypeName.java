package com.tessera.eventmodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsed event type of the form {@code {subject}.{action}.{phase}}, e.g. {@code
 * entities.create.requested}.
 *
 * <p>The dispatcher's wildcard subscriptions and the permission governor both rely on this
 * three-segment convention, so every type flowing through the pipeline is parsed once here.
 *
 * @param subject the namespace the command is about (e.g. "entities", "documents")
 * @param action the verb (e.g. "create", "delete", "addMember")
 * @param phase the lifecycle phase
 */
public record EventTypeName(String subject, String action, EventPhase phase) {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");

    public EventTypeName {
        if (subject == null || !SEGMENT.matcher(subject).matches()) {
            throw new IllegalArgumentException("Invalid event subject: " + subject);
        }
        if (action == null || !SEGMENT.matcher(action).matches()) {
            throw new IllegalArgumentException("Invalid event action: " + action);
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase must not be null");
        }
    }

    public static EventTypeName of(String subject, String action, EventPhase phase) {
        return new EventTypeName(subject, action, phase);
    }

    /**
     * Parses a dot-delimited type string.
     *
     * @throws IllegalArgumentException if the string does not have exactly three valid segments
     */
    @JsonCreator
    public static EventTypeName parse(String value) {
        return tryParse(value)
                .orElseThrow(
                        () ->
                                new IllegalArgumentException(
                                        "Event type must look like {subject}.{action}.{phase}: "
                                                + value));
    }

    /** Parses a type string, returning empty instead of throwing when it is malformed. */
    public static Optional<EventTypeName> tryParse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String[] parts = value.split("\\.", -1);
        if (parts.length != 3
                || !SEGMENT.matcher(parts[0]).matches()
                || !SEGMENT.matcher(parts[1]).matches()) {
            return Optional.empty();
        }
        return EventPhase.fromString(parts[2]).map(phase -> new EventTypeName(parts[0], parts[1], phase));
    }

    /** Same subject and action, different phase. */
    public EventTypeName withPhase(EventPhase newPhase) {
        return new EventTypeName(subject, action, newPhase);
    }

    /** The {@code {subject}.{action}} prefix shared by every phase of one command. */
    public String command() {
        return subject + "." + action;
    }

    @JsonValue
    public String value() {
        return subject + "." + action + "." + phase.value();
    }

    @Override
    public String toString() {
        return value();
    }
}
