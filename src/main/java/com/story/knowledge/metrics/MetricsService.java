package com.story.knowledge.metrics;

import com.story.knowledge.core.model.StoreSide;

import java.time.Duration;

/**
 * Interface for recording transaction coordinator metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    /**
     * Records the wall time of a transaction from begin to its terminal state.
     *
     * @param outcome terminal transaction state, e.g. {@code COMMITTED}
     */
    void recordTransactionDuration(String outcome, Duration duration);

    void incrementPrepareRetry(StoreSide side);

    void incrementAborted(StoreSide side);

    void incrementPartialCommit(StoreSide failedSide);

    void incrementLockConflict();

    void incrementReconciliationResolved();
}
