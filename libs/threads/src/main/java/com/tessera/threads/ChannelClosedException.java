package com.tessera.threads;

/** Thrown to a producer sending into a channel its consumer has closed. */
public class ChannelClosedException extends RuntimeException {

    public ChannelClosedException() {
        super("Content channel is closed");
    }
}
