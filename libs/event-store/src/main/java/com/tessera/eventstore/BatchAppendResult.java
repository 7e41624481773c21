package com.tessera.eventstore;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of {@link EventStore#appendBatch(List)}, one item per input event in input order.
 *
 * @param items per-event outcomes
 */
public record BatchAppendResult(List<Item> items) {

    public BatchAppendResult {
        items = List.copyOf(items);
    }

    /**
     * @param index position in the submitted batch
     * @param eventId id of the submitted event, null when the event itself was null
     * @param stored the stored event when the append succeeded
     * @param error failure message when it did not
     */
    public record Item(int index, UUID eventId, StoredEvent stored, String error) {

        public boolean succeeded() {
            return stored != null;
        }
    }

    public long successCount() {
        return items.stream().filter(Item::succeeded).count();
    }

    public long failureCount() {
        return items.size() - successCount();
    }

    public boolean allSucceeded() {
        return failureCount() == 0;
    }
}
