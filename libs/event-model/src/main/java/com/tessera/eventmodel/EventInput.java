package com.tessera.eventmodel;

import java.util.Map;

/**
 * What a caller supplies to create a root event. Everything not listed here (id, timestamp,
 * defaults) is assigned by {@link EventFactory}.
 *
 * @param type full event type
 * @param subjectId aggregate id; a fresh UUID is assigned when null
 * @param subjectType aggregate kind; defaults to the type's subject
 * @param data raw payload, validated against the type's schema
 * @param metadata initial metadata
 * @param userId acting user
 * @param source originator; defaults to {@link EventSource#USER}
 * @param correlationId groups related events; a fresh UUID is assigned when null
 * @param causationId direct cause, if any
 * @param requestId client request id
 */
public record EventInput(
        EventTypeName type,
        String subjectId,
        String subjectType,
        Map<String, Object> data,
        Map<String, Object> metadata,
        String userId,
        EventSource source,
        String correlationId,
        String causationId,
        String requestId) {

    public EventInput {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
    }

    public static EventInput of(EventTypeName type, String userId, Map<String, Object> data) {
        return new EventInput(type, null, null, data, null, userId, null, null, null, null);
    }

    public EventInput withSubject(String newSubjectId, String newSubjectType) {
        return new EventInput(
                type, newSubjectId, newSubjectType, data, metadata, userId, source, correlationId,
                causationId, requestId);
    }

    public EventInput withSource(EventSource newSource) {
        return new EventInput(
                type, subjectId, subjectType, data, metadata, userId, newSource, correlationId,
                causationId, requestId);
    }

    public EventInput withMetadata(Map<String, Object> newMetadata) {
        return new EventInput(
                type, subjectId, subjectType, data, newMetadata, userId, source, correlationId,
                causationId, requestId);
    }

    public EventInput withCorrelation(String newCorrelationId, String newCausationId) {
        return new EventInput(
                type, subjectId, subjectType, data, metadata, userId, source, newCorrelationId,
                newCausationId, requestId);
    }

    public EventInput withRequestId(String newRequestId) {
        return new EventInput(
                type, subjectId, subjectType, data, metadata, userId, source, correlationId,
                causationId, newRequestId);
    }
}
