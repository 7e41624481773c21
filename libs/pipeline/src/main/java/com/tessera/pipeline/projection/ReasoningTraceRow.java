package com.tessera.pipeline.projection;

import java.util.List;
import java.util.Map;

/** An agent's reasoning behind one event. */
public record ReasoningTraceRow(
        String subjectType,
        String subjectId,
        String sourceEventId,
        String agentId,
        List<Map<String, Object>> steps,
        Map<String, Object> outcome,
        Long durationMs,
        String userId) {}
