package com.tessera.threads;

/** The thread's terminal hash kept moving under a writer, or its status forbids the change. */
public class ThreadConflictException extends RuntimeException {

    public ThreadConflictException(String message) {
        super(message);
    }
}
