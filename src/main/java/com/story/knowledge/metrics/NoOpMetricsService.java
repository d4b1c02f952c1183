package com.story.knowledge.metrics;

import com.story.knowledge.core.model.StoreSide;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordTransactionDuration(String outcome, Duration duration) {
    }

    @Override
    public void incrementPrepareRetry(StoreSide side) {
    }

    @Override
    public void incrementAborted(StoreSide side) {
    }

    @Override
    public void incrementPartialCommit(StoreSide failedSide) {
    }

    @Override
    public void incrementLockConflict() {
    }

    @Override
    public void incrementReconciliationResolved() {
    }
}
