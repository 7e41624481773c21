package com.tessera.pipeline.dispatch;

import java.time.Duration;

/**
 * What one handler did with one event.
 *
 * @param handler handler name
 * @param status success or failure
 * @param result the handler's result description, on success
 * @param error failure message, on failure
 * @param duration how long the handler ran
 */
public record HandlerOutcome(
        String handler, Status status, String result, String error, Duration duration) {

    public enum Status {
        SUCCESS,
        FAILED
    }

    public static HandlerOutcome success(String handler, Object result, Duration duration) {
        return new HandlerOutcome(
                handler, Status.SUCCESS, result == null ? null : result.toString(), null, duration);
    }

    public static HandlerOutcome failure(String handler, Throwable error, Duration duration) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new HandlerOutcome(handler, Status.FAILED, null, message, duration);
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }
}
