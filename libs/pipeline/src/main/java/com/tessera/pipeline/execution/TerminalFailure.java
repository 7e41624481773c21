package com.tessera.pipeline.execution;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An execution that gave up: retries exhausted or a non-retryable error.
 *
 * @param executionId execution that failed (the validated event id)
 * @param eventId the validated event
 * @param eventType its type
 * @param subjectId aggregate it targeted
 * @param userId acting user
 * @param worker worker name
 * @param attempts attempts made
 * @param errorType exception class
 * @param error exception message
 * @param failedAt when the worker gave up
 */
public record TerminalFailure(
        String executionId,
        UUID eventId,
        String eventType,
        String subjectId,
        String userId,
        String worker,
        int attempts,
        String errorType,
        String error,
        Instant failedAt) {

    /** Form written into the validated event's metadata. */
    public Map<String, Object> toMetadata() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("worker", worker);
        map.put("attempts", attempts);
        map.put("errorType", errorType);
        map.put("error", error);
        map.put("failedAt", failedAt.toString());
        return map;
    }
}
