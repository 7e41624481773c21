package com.tessera.pipeline.publish;

import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventstore.EventStore;
import com.tessera.eventstore.StoredEvent;
import com.tessera.eventstore.UnknownEventException;
import com.tessera.pipeline.dispatch.DispatchSummary;
import com.tessera.pipeline.dispatch.Dispatcher;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends an event and hands it to the dispatcher. The append is durable before dispatch starts,
 * so a handler failure never undoes it.
 *
 * <p>An event whose id is already stored is not dispatched again. Handlers that derive their
 * follow-up events with stable ids therefore trigger downstream work once, however often they are
 * redelivered.
 */
public class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final EventStore store;
    private final Dispatcher dispatcher;

    public EventPublisher(EventStore store, Dispatcher dispatcher) {
        this.store = store;
        this.dispatcher = dispatcher;
    }

    /**
     * The appended event and its pending dispatch.
     *
     * @param stored the event as stored, with its stream version
     * @param dispatched completes with the dispatch summary once every handler finished
     * @param appended false when the event was already stored and this call changed nothing
     */
    public record Publication(
            StoredEvent stored, CompletableFuture<DispatchSummary> dispatched, boolean appended) {

        public EventEnvelope event() {
            return stored.event();
        }
    }

    /**
     * Appends then dispatches asynchronously.
     *
     * @throws com.tessera.eventmodel.SchemaValidationException when the event fails validation;
     *     nothing is appended or dispatched
     */
    public Publication publish(EventEnvelope event) {
        Optional<StoredEvent> appended = store.appendIfAbsent(event);
        if (appended.isEmpty()) {
            StoredEvent existing =
                    store.findById(event.id()).orElseThrow(() -> new UnknownEventException(event.id()));
            log.debug("{} {} was already published, not dispatching again", event.type(), event.id());
            return new Publication(
                    existing,
                    CompletableFuture.completedFuture(
                            DispatchSummary.none(event.id(), event.type().value())),
                    false);
        }
        StoredEvent stored = appended.get();
        log.debug(
                "Appended {} {} at version {} of {}",
                event.type(),
                event.id(),
                stored.version(),
                event.subjectId());
        return new Publication(stored, dispatcher.dispatchAsync(stored.event()), true);
    }

    public EventStore store() {
        return store;
    }
}
