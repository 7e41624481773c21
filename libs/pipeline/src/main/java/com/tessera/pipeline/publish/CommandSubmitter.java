package com.tessera.pipeline.publish;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.EventFactory;
import com.tessera.eventmodel.EventInput;
import com.tessera.eventmodel.EventPhase;
import com.tessera.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for commands from every outer surface: the API, webhooks and the insight endpoint
 * all turn their input into a {@code .requested} event here.
 */
public class CommandSubmitter {

    private static final Logger log = LoggerFactory.getLogger(CommandSubmitter.class);

    private final EventFactory factory;
    private final EventPublisher publisher;
    private final MetricFactory metrics;

    public CommandSubmitter(EventFactory factory, EventPublisher publisher, MetricFactory metrics) {
        this.factory = factory;
        this.publisher = publisher;
        this.metrics = metrics;
    }

    /**
     * Creates, appends and dispatches a requested event.
     *
     * @throws IllegalArgumentException when the type is not a {@code .requested} type
     * @throws com.tessera.eventmodel.SchemaValidationException when the data fails the schema
     */
    public SubmissionReceipt submit(EventInput input) {
        if (input.type().phase() != EventPhase.REQUESTED) {
            throw new IllegalArgumentException(
                    "Only requested events can be submitted, got " + input.type());
        }
        EventEnvelope event = factory.createEvent(input);
        publisher.publish(event);
        metrics.counter(
                        "commands.submitted",
                        "Commands accepted into the pipeline",
                        "command", event.type().command(),
                        "source", event.source().value())
                .increment();
        log.info(
                "Accepted {} {} from {} (source {})",
                event.type(),
                event.id(),
                event.userId(),
                event.source().value());
        return SubmissionReceipt.requested(event.id(), event.correlationId());
    }
}
