package com.tessera.eventstore;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.SchemaRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} held in memory. Each stream is an immutable list swapped by compare-and-set,
 * so concurrent writers to one stream never see torn versions and writers to different streams
 * never contend.
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final SchemaRegistry schemas;
    private final Map<String, AtomicReference<List<StoredEvent>>> streams = new ConcurrentHashMap<>();
    private final Map<UUID, String> subjectById = new ConcurrentHashMap<>();

    public InMemoryEventStore(SchemaRegistry schemas) {
        this.schemas = schemas;
    }

    @Override
    public StoredEvent append(EventEnvelope event) {
        return doAppend(event, null).stored();
    }

    @Override
    public StoredEvent append(EventEnvelope event, long expectedVersion) {
        return doAppend(event, expectedVersion).stored();
    }

    @Override
    public Optional<StoredEvent> appendIfAbsent(EventEnvelope event) {
        Appended appended = doAppend(event, null);
        return appended.created() ? Optional.of(appended.stored()) : Optional.empty();
    }

    private record Appended(StoredEvent stored, boolean created) {}

    private Appended doAppend(EventEnvelope event, Long expectedVersion) {
        AppendChecks.check(schemas, event);
        Optional<StoredEvent> existing = findById(event.id());
        if (existing.isPresent()) {
            log.debug("Event {} already appended, returning stored copy", event.id());
            return new Appended(existing.get(), false);
        }

        var stream = streams.computeIfAbsent(event.subjectId(), k -> new AtomicReference<>(List.of()));
        // registered before the swap so findById resolves as soon as the event is visible
        subjectById.putIfAbsent(event.id(), event.subjectId());
        while (true) {
            List<StoredEvent> current = stream.get();
            // a concurrent append of the same id may have won the previous swap
            for (StoredEvent stored : current) {
                if (stored.event().id().equals(event.id())) {
                    log.debug("Event {} appended concurrently, returning stored copy", event.id());
                    return new Appended(stored, false);
                }
            }
            long actual = current.size();
            if (expectedVersion != null && expectedVersion != actual) {
                throw new ConcurrencyConflictException(event.subjectId(), expectedVersion, actual);
            }
            var stored = new StoredEvent(event, actual + 1);
            var next = new ArrayList<StoredEvent>(current.size() + 1);
            next.addAll(current);
            next.add(stored);
            if (stream.compareAndSet(current, List.copyOf(next))) {
                log.debug("Appended {} {} as version {}", event.type(), event.id(), stored.version());
                return new Appended(stored, true);
            }
        }
    }

    @Override
    public BatchAppendResult appendBatch(List<EventEnvelope> events) {
        var items = new ArrayList<BatchAppendResult.Item>(events.size());
        for (int i = 0; i < events.size(); i++) {
            EventEnvelope event = events.get(i);
            UUID id = event == null ? null : event.id();
            try {
                items.add(new BatchAppendResult.Item(i, id, append(event), null));
            } catch (RuntimeException e) {
                log.warn("Batch item {} ({}) rejected: {}", i, id, e.getMessage());
                items.add(new BatchAppendResult.Item(i, id, null, e.getMessage()));
            }
        }
        return new BatchAppendResult(items);
    }

    @Override
    public List<StoredEvent> getAggregateStream(String subjectId) {
        var stream = streams.get(subjectId);
        return stream == null ? List.of() : stream.get();
    }

    @Override
    public OptionalLong getAggregateVersion(String subjectId) {
        List<StoredEvent> stream = getAggregateStream(subjectId);
        return stream.isEmpty() ? OptionalLong.empty() : OptionalLong.of(stream.size());
    }

    @Override
    public Optional<StoredEvent> findById(UUID eventId) {
        String subjectId = subjectById.get(eventId);
        if (subjectId == null) {
            return Optional.empty();
        }
        return getAggregateStream(subjectId).stream()
                .filter(s -> s.event().id().equals(eventId))
                .findFirst();
    }

    @Override
    public List<StoredEvent> getCorrelatedEvents(String correlationId) {
        return allEvents()
                .filter(s -> correlationId.equals(s.event().correlationId()))
                .sorted(TIMESTAMP_ORDER)
                .toList();
    }

    @Override
    public List<StoredEvent> readAll(Instant fromInclusive) {
        return allEvents()
                .filter(s -> fromInclusive == null || !s.event().timestamp().isBefore(fromInclusive))
                .sorted(TIMESTAMP_ORDER)
                .toList();
    }

    @Override
    public StoredEvent annotate(UUID eventId, String key, Object value) {
        String subjectId = subjectById.get(eventId);
        if (subjectId == null) {
            throw new UnknownEventException(eventId);
        }
        var stream = streams.get(subjectId);
        while (true) {
            List<StoredEvent> current = stream.get();
            var next = new ArrayList<StoredEvent>(current.size());
            StoredEvent annotated = null;
            for (StoredEvent stored : current) {
                if (stored.event().id().equals(eventId)) {
                    annotated = stored.withEvent(stored.event().withAnnotation(key, value));
                    next.add(annotated);
                } else {
                    next.add(stored);
                }
            }
            if (annotated == null) {
                throw new UnknownEventException(eventId);
            }
            if (stream.compareAndSet(current, List.copyOf(next))) {
                return annotated;
            }
        }
    }

    private java.util.stream.Stream<StoredEvent> allEvents() {
        return streams.values().stream().flatMap(ref -> ref.get().stream());
    }

    static final Comparator<StoredEvent> TIMESTAMP_ORDER =
            Comparator.comparing((StoredEvent s) -> s.event().timestamp())
                    .thenComparing(StoredEvent::version);
}
