package com.tessera.observability;

/**
 * Identifiers that follow one unit of work (an HTTP request, a handler run) through the pipeline.
 *
 * <p>Set on the current thread via {@link CorrelationContextHolder}, which mirrors every non-null
 * field into SLF4J's MDC so log lines carry them without the caller passing them around.
 *
 * @param correlationId groups every event of one logical request
 * @param causationId id of the event that caused the current work (nullable)
 * @param userId acting user (nullable for system work)
 * @param workspaceId workspace the work is scoped to (nullable for personal resources)
 * @param requestId client request id (nullable)
 * @param eventId event currently being handled (nullable outside handlers)
 */
public record CorrelationContext(
        String correlationId,
        String causationId,
        String userId,
        String workspaceId,
        String requestId,
        String eventId) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_CAUSATION_ID = "causationId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_WORKSPACE_ID = "workspaceId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_EVENT_ID = "eventId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** A context carrying only a correlation id, e.g. for an incoming HTTP request. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null, null, null);
    }

    public CorrelationContext withUser(String newUserId) {
        return new CorrelationContext(
                correlationId, causationId, newUserId, workspaceId, requestId, eventId);
    }

    public CorrelationContext withRequestId(String newRequestId) {
        return new CorrelationContext(
                correlationId, causationId, userId, workspaceId, newRequestId, eventId);
    }
}
