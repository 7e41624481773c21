package com.tessera.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates Micrometer meters with consistent naming and a {@code service} tag.
 *
 * <p>Every name is prefixed with {@code tessera.} so pipeline meters are easy to find next to the
 * JVM and HTTP meters Spring Boot registers. Micrometer caches meters by name and tags, so calling
 * a method twice with the same arguments returns the same meter.
 */
public final class MetricFactory {

    public static final String PREFIX = "tessera.";
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * @param name metric name without the {@code tessera.} prefix, e.g. "dispatch.handler.failures"
     * @param tags additional key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(PREFIX + name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(PREFIX + name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    /** Registers a gauge and returns the value holder that drives it. */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong();
        Gauge.builder(PREFIX + name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(tags(tags))
                .register(registry);
        return value;
    }

    /** Starts a timing sample to be stopped against a timer built once the outcome is known. */
    public Timer.Sample startSample() {
        return Timer.start(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        return extraTags.length > 0 ? tags.and(extraTags) : tags;
    }
}
