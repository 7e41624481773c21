package com.tessera.pipeline.execution;

import java.time.Duration;

/**
 * How often a worker retries a failing execution and how long it waits in between.
 *
 * @param maxAttempts total attempts including the first
 * @param initialBackoff wait after the first failure
 * @param multiplier growth factor of the wait per further failure
 * @param maxBackoff upper bound of any single wait
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be null or negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
    }

    /** 3 attempts, waiting 1s then 2s. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));
    }

    /** Retries immediately; for tests and in-process runs. */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /** Wait before attempt {@code failedAttempt + 1}. */
    public Duration backoffAfter(int failedAttempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }

    public boolean hasAttemptsLeft(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }
}
