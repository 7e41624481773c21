package com.tessera.pipeline.dispatch;

/** A handler failed to process an event. Isolated by the dispatcher; never stops other handlers. */
public class HandlerExecutionException extends RuntimeException {

    private final String handler;

    public HandlerExecutionException(String handler, String message, Throwable cause) {
        super(message, cause);
        this.handler = handler;
    }

    public String handler() {
        return handler;
    }
}
