package com.story.knowledge.transaction;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of a {@link TransactionCoordinator}.
 *
 * @param prepareTimeout deadline for the whole prepare phase, retries included
 * @param commitTimeout  deadline for the whole commit phase
 * @param retryPolicy    retry of transient prepare failures
 * @param conflictPolicy behaviour of {@code begin} on a locked entity
 * @param lockWait       maximum wait for a lock under {@link ConflictPolicy#WAIT}
 */
public record CoordinatorConfig(
        Duration prepareTimeout,
        Duration commitTimeout,
        RetryPolicy retryPolicy,
        ConflictPolicy conflictPolicy,
        Duration lockWait
) {
    public CoordinatorConfig {
        requirePositive(prepareTimeout, "prepareTimeout");
        requirePositive(commitTimeout, "commitTimeout");
        requirePositive(lockWait, "lockWait");
        Objects.requireNonNull(retryPolicy, "retryPolicy is required");
        Objects.requireNonNull(conflictPolicy, "conflictPolicy is required");
    }

    /**
     * 10s prepare, 10s commit, 3 attempts, WAIT up to 5s.
     */
    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig(Duration.ofSeconds(10), Duration.ofSeconds(10),
                RetryPolicy.defaults(), ConflictPolicy.WAIT, Duration.ofSeconds(5));
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
