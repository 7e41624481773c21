package com.tessera.pipeline.publish;

import java.util.UUID;

/**
 * Synchronous answer to a command submission. Terminal effects arrive later through notifications
 * or by polling the event.
 */
public record SubmissionReceipt(String status, UUID id, String correlationId) {

    public static final String REQUESTED = "requested";

    public static SubmissionReceipt requested(UUID id, String correlationId) {
        return new SubmissionReceipt(REQUESTED, id, correlationId);
    }
}
