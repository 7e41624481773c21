package com.tessera.pipeline.execution;

import com.tessera.eventmodel.EventFactory;
import com.tessera.observability.MetricFactory;
import com.tessera.pipeline.notification.RealtimeNotifier;
import com.tessera.pipeline.publish.EventPublisher;
import java.time.Clock;

/** Collaborators every execution worker needs. */
public record ExecutionSupport(
        EventFactory factory,
        EventPublisher publisher,
        StepResultStore steps,
        RetryPolicy retryPolicy,
        FailureLedger failures,
        RealtimeNotifier notifier,
        MetricFactory metrics,
        Clock clock) {

    public ExecutionSupport {
        if (factory == null || publisher == null || steps == null || retryPolicy == null
                || failures == null || notifier == null || metrics == null || clock == null) {
            throw new IllegalArgumentException("execution collaborators must not be null");
        }
    }
}
