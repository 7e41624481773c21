package com.tessera.pipeline.execution;

/**
 * A failure another attempt cannot fix, such as a version conflict or a missing row. The worker
 * records it as terminal right away.
 */
public class NonRetryableExecutionException extends RuntimeException {

    public NonRetryableExecutionException(String message) {
        super(message);
    }

    public NonRetryableExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
