package com.tessera.pipeline.dispatch;

import com.tessera.eventmodel.EventTypeName;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Which handlers run for which event types. An explicit value owned by whoever builds the
 * pipeline; there is no global registry.
 */
public final class HandlerRegistry {

    /** A named handler and the pattern it subscribed with. */
    public record Registration(String name, EventTypePattern pattern, EventHandler handler) {}

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    /**
     * Subscribes {@code handler} under a unique {@code name}.
     *
     * @throws IllegalStateException when the name is taken
     * @throws IllegalArgumentException when the pattern is malformed
     */
    public HandlerRegistry register(String name, String pattern, EventHandler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        var registration = new Registration(name, EventTypePattern.parse(pattern), handler);
        synchronized (registrations) {
            if (registrations.stream().anyMatch(r -> r.name().equals(name))) {
                throw new IllegalStateException("Handler already registered: " + name);
            }
            registrations.add(registration);
        }
        return this;
    }

    public boolean unregister(String name) {
        return registrations.removeIf(r -> r.name().equals(name));
    }

    /** Handlers whose pattern matches {@code type}, in registration order. */
    public List<Registration> handlersFor(EventTypeName type) {
        return registrations.stream().filter(r -> r.pattern().matches(type)).toList();
    }

    public List<Registration> registrations() {
        return List.copyOf(registrations);
    }
}
