package com.tessera.threads;

/** A streamed message could not be completed: the producer failed, stalled, or was interrupted. */
public class StreamFailedException extends RuntimeException {

    public StreamFailedException(String message) {
        super(message);
    }

    public StreamFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
