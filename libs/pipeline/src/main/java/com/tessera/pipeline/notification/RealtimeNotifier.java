package com.tessera.pipeline.notification;

/**
 * Pushes pipeline outcomes to subscribers. Implementations never throw: a failed push is logged
 * and reported as {@link NotificationOutcome#FAILED}, and the pipeline carries on.
 */
public interface RealtimeNotifier {

    NotificationOutcome notify(RealtimeMessage message);
}
