package com.story.knowledge.transaction;

import java.util.Objects;

/**
 * Bounded retry of transient prepare failures.
 *
 * @param maxAttempts total attempts per store, including the first one
 * @param backoff     delay between attempts
 */
public record RetryPolicy(int maxAttempts, BackoffCalculator backoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(backoff, "backoff is required");
    }

    /**
     * Three attempts with default backoff.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, new BackoffCalculator());
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, new BackoffCalculator());
    }
}
