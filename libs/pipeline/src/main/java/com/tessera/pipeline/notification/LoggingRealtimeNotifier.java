package com.tessera.pipeline.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Used when no real-time service is configured: logs the push and reports it skipped. */
public class LoggingRealtimeNotifier implements RealtimeNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingRealtimeNotifier.class);

    @Override
    public NotificationOutcome notify(RealtimeMessage message) {
        log.debug("No real-time service configured; dropping {} for user {}", message.type(), message.userId());
        return NotificationOutcome.SKIPPED;
    }
}
