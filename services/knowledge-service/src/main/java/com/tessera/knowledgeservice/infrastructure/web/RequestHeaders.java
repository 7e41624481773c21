package com.tessera.knowledgeservice.infrastructure.web;

/** Header names of the HTTP contract. */
public final class RequestHeaders {

    public static final String CORRELATION_ID = "X-Correlation-ID";
    public static final String REQUEST_ID = "X-Request-ID";
    public static final String USER_ID = "X-User-Id";
    public static final String WEBHOOK_SECRET = "X-Webhook-Secret";

    private RequestHeaders() {
        // utility class
    }
}
