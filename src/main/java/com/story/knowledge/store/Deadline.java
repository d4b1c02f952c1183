package com.story.knowledge.store;

import java.time.Duration;
import java.time.Instant;

/**
 * Point in time by which a blocking store call has to complete.
 */
public record Deadline(Instant expiresAt) {

    private static final Deadline NONE = new Deadline(Instant.MAX);

    public static Deadline after(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        return new Deadline(Instant.now().plus(timeout));
    }

    public static Deadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return this != NONE && !Instant.now().isBefore(expiresAt);
    }

    /**
     * Time left, zero once expired. {@code Duration.ofDays(365)} stands in for "no deadline".
     */
    public Duration remaining() {
        if (this == NONE) {
            return Duration.ofDays(365);
        }
        Duration left = Duration.between(Instant.now(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
