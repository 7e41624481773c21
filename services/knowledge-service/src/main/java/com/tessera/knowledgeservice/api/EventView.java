package com.tessera.knowledgeservice.api;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.EventSerializer;
import com.tessera.eventstore.StoredEvent;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** JSON view of a stored event. */
public record EventView(
        UUID id,
        String type,
        String subjectId,
        String subjectType,
        long version,
        Map<String, Object> data,
        Map<String, Object> metadata,
        String userId,
        String source,
        Instant timestamp,
        String correlationId,
        String causationId,
        String requestId) {

    public static EventView of(StoredEvent stored) {
        EventEnvelope event = stored.event();
        return new EventView(
                event.id(),
                event.type().value(),
                event.subjectId(),
                event.subjectType(),
                stored.version(),
                EventSerializer.toMap(event.data()),
                EventSerializer.toMap(event.metadata()),
                event.userId(),
                event.source().value(),
                event.timestamp(),
                event.correlationId(),
                event.causationId(),
                event.requestId());
    }
}
