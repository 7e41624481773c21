package com.tessera.knowledgeservice.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.UUID;

/**
 * Outcome of one webhook item. Accepted items carry the id of their requested event, rejected ones
 * the reason.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookItemResult(int index, String status, UUID id, String error) {

    public static final String ACCEPTED = "accepted";
    public static final String REJECTED = "rejected";

    static WebhookItemResult accepted(int index, UUID id) {
        return new WebhookItemResult(index, ACCEPTED, id, null);
    }

    static WebhookItemResult rejected(int index, String error) {
        return new WebhookItemResult(index, REJECTED, null, error);
    }
}
