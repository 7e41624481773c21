package com.tessera.pipeline.notification;

/** Result of a best-effort real-time push. Never retried either way. */
public enum NotificationOutcome {
    DELIVERED,
    FAILED,
    SKIPPED
}
