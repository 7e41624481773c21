package com.tessera.threads;

public class UnknownThreadException extends RuntimeException {

    private final String threadId;

    public UnknownThreadException(String threadId) {
        super("Thread not found: " + threadId);
        this.threadId = threadId;
    }

    public String threadId() {
        return threadId;
    }
}
