package com.story.knowledge.metrics;

import com.story.knowledge.core.model.StoreSide;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code knowledge.transaction.duration}: Timer (tag: outcome)</li>
 *   <li>{@code knowledge.prepare.retries}: Counter (tag: side)</li>
 *   <li>{@code knowledge.transaction.aborted}: Counter (tag: side)</li>
 *   <li>{@code knowledge.transaction.partial}: Counter (tag: failedSide)</li>
 *   <li>{@code knowledge.lock.conflicts}: Counter</li>
 *   <li>{@code knowledge.reconciliation.resolved}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter lockConflictCounter;
    private final Counter reconciliationResolvedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.lockConflictCounter = Counter.builder("knowledge.lock.conflicts")
                .description("Number of transactions refused because the entity was locked")
                .register(registry);
        this.reconciliationResolvedCounter = Counter.builder("knowledge.reconciliation.resolved")
                .description("Number of reconciliation events driven to COMMITTED")
                .register(registry);
    }

    @Override
    public void recordTransactionDuration(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("knowledge.transaction.duration")
                        .description("Duration of dual-store transactions")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementPrepareRetry(StoreSide side) {
        sideCounter("knowledge.prepare.retries", "side", side,
                "Number of prepare attempts retried after a transient failure").increment();
    }

    @Override
    public void incrementAborted(StoreSide side) {
        sideCounter("knowledge.transaction.aborted", "side", side,
                "Number of transactions aborted before any commit").increment();
    }

    @Override
    public void incrementPartialCommit(StoreSide failedSide) {
        sideCounter("knowledge.transaction.partial", "failedSide", failedSide,
                "Number of transactions that committed on one store only").increment();
    }

    @Override
    public void incrementLockConflict() {
        lockConflictCounter.increment();
    }

    @Override
    public void incrementReconciliationResolved() {
        reconciliationResolvedCounter.increment();
    }

    private Counter sideCounter(String name, String tag, StoreSide side, String description) {
        String key = name + ":" + side;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tag, side != null ? side.name() : "UNKNOWN")
                        .register(registry));
    }
}
