package com.tessera.threads;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded hand-off between a content producer (e.g. a model streaming tokens) and the thread log.
 *
 * <p>A full channel blocks the producer. The consumer closes the channel when it stops reading,
 * and a producer blocked in or calling {@link #send} then gets a {@link ChannelClosedException}.
 */
public class ContentChannel {

    private static final long SEND_POLL_MILLIS = 50;

    private final BlockingQueue<ContentChunk> queue;
    private final AtomicBoolean closed = new AtomicBoolean();

    public ContentChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Waits for room and enqueues {@code chunk}.
     *
     * @throws ChannelClosedException when the channel is or becomes closed
     */
    public void send(ContentChunk chunk) throws InterruptedException {
        while (true) {
            if (closed.get()) {
                throw new ChannelClosedException();
            }
            if (queue.offer(chunk, SEND_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                return;
            }
        }
    }

    /** The next chunk, or empty if none arrived within {@code timeout}. */
    public Optional<ContentChunk> receive(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }
}
