package com.story.knowledge.reconcile;

import com.story.knowledge.core.exception.ConcurrencyConflictException;
import com.story.knowledge.core.exception.KnowledgeBaseException;
import com.story.knowledge.core.model.ChangeEvent;
import com.story.knowledge.core.model.ChangeStatus;
import com.story.knowledge.core.model.ContentHash;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.Relationship;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.core.model.StoryElementNode;
import com.story.knowledge.core.model.TransactionPhase;
import com.story.knowledge.ledger.ChangeEventLedger;
import com.story.knowledge.logging.LogContext;
import com.story.knowledge.metrics.MetricsService;
import com.story.knowledge.store.GraphOperation;
import com.story.knowledge.store.VectorEntry;
import com.story.knowledge.transaction.CommitResult;
import com.story.knowledge.transaction.TransactionCoordinator;
import com.story.knowledge.transaction.TransactionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Completes transactions left {@code PARTIALLY_COMMITTED}.
 *
 * <p>A sweep walks the ledger's unresolved {@code RECONCILIATION_REQUIRED} events
 * raised during commit and re-applies the failed side through the coordinator,
 * from the payload ledgered with the event. Every re-applied write is an upsert,
 * so a sweep can run any number of times. When a later transaction already wrote
 * the failed side, the event is resolved as superseded instead, so old content
 * never overwrites newer content. Events from failed rollbacks are reported as
 * skipped and left for manual repair.</p>
 */
public class ReconciliationService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final TransactionCoordinator coordinator;
    private final ChangeEventLedger ledger;
    private final MetricsService metrics;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> scheduled;

    public ReconciliationService(TransactionCoordinator coordinator, ChangeEventLedger ledger, MetricsService metrics) {
        this.coordinator = coordinator;
        this.ledger = ledger;
        this.metrics = metrics;
    }

    /**
     * Runs one sweep over the unresolved reconciliation events.
     */
    public synchronized ReconciliationReport reconcilePending() {
        int examined = 0;
        int reconciled = 0;
        int superseded = 0;
        int failed = 0;
        int skipped = 0;

        try (LogContext ignored = LogContext.forReconciliation(UUID.randomUUID().toString())) {
            for (ChangeEvent event : ledger.findUnresolvedReconciliations()) {
                examined++;
                switch (reconcile(event)) {
                    case RECONCILED -> reconciled++;
                    case SUPERSEDED -> superseded++;
                    case FAILED -> failed++;
                    case SKIPPED -> skipped++;
                }
            }
            ReconciliationReport report = new ReconciliationReport(examined, reconciled, superseded, failed, skipped);
            if (examined > 0) {
                log.info("reconciliation.sweep examined={} reconciled={} superseded={} failed={} skipped={}",
                        examined, reconciled, superseded, failed, skipped);
            }
            return report;
        }
    }

    /**
     * Sweeps every {@code interval} on a background thread until {@link #stop()}.
     */
    public synchronized void start(Duration interval) {
        if (scheduled != null) {
            throw new IllegalStateException("Reconciliation is already scheduled");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "story-knowledge-reconciler");
            thread.setDaemon(true);
            return thread;
        });
        scheduled = scheduler.scheduleWithFixedDelay(this::sweepSafely,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Reconciliation scheduled every {}", interval);
    }

    public synchronized void stop() {
        if (scheduled != null) {
            scheduled.cancel(false);
            scheduler.shutdown();
            scheduled = null;
            scheduler = null;
            log.info("Reconciliation stopped");
        }
    }

    public synchronized boolean isRunning() {
        return scheduled != null;
    }

    @Override
    public void close() {
        stop();
    }

    private void sweepSafely() {
        try {
            reconcilePending();
        } catch (RuntimeException e) {
            // an escaping exception would cancel every later run
            log.error("Reconciliation sweep failed: {}", e.getMessage(), e);
        }
    }

    enum Outcome { RECONCILED, SUPERSEDED, FAILED, SKIPPED }

    private Outcome reconcile(ChangeEvent event) {
        Map<String, Object> payload = event.payload();
        if (!TransactionPhase.COMMIT.name().equals(payload.get("phase"))) {
            log.warn("reconciliation.manual transactionId={} entityId={} phase={}",
                    event.transactionId(), event.entityId(), payload.get("phase"));
            return Outcome.SKIPPED;
        }
        StoreSide failedSide = StoreSide.valueOf((String) payload.get("failedSide"));
        if (failedSide == StoreSide.VECTOR && !(payload.get("content") instanceof String)) {
            log.error("reconciliation.unrecoverable transactionId={} entityId={} reason=no content ledgered",
                    event.transactionId(), event.entityId());
            return markFailed(event);
        }

        Optional<ChangeEvent> newer = laterWriteOf(event, failedSide);
        if (newer.isPresent()) {
            return resolve(event, Map.of("resolution", "superseded",
                    "resolvedBy", newer.get().transactionId()), Outcome.SUPERSEDED);
        }

        TransactionHandle handle;
        try {
            handle = coordinator.begin(event.entityId());
        } catch (ConcurrencyConflictException e) {
            log.debug("Entity {} busy, reconciling on the next sweep", event.entityId());
            return Outcome.SKIPPED;
        }
        try {
            stageFailedSide(handle, event, failedSide);
            coordinator.prepare(handle);
            CommitResult result = coordinator.commit(handle);
            return resolve(event, Map.of("resolution", "reconciled",
                    "resolvedBy", result.transactionId()), Outcome.RECONCILED);
        } catch (KnowledgeBaseException e) {
            log.warn("reconciliation.failed transactionId={} entityId={} error={}",
                    event.transactionId(), event.entityId(), e.getMessage());
            if (!handle.getState().isTerminal()) {
                coordinator.rollback(handle);
            }
            return Outcome.FAILED;
        }
    }

    private void stageFailedSide(TransactionHandle handle, ChangeEvent event, StoreSide failedSide) {
        Map<String, Object> payload = event.payload();
        EntityIdentifier entityId = event.entityId();
        if (failedSide == StoreSide.VECTOR) {
            coordinator.stageVectorOp(handle, new VectorEntry(entityId, (String) payload.get("content"),
                    stringMap(payload.get("metadata"))));
            return;
        }
        String hash = (String) payload.get("contentHash");
        coordinator.stageGraphOp(handle, new GraphOperation.UpsertNode(new StoryElementNode(entityId,
                (String) payload.get("elementType"), hash != null ? new ContentHash(hash) : null)));
        Object relationships = payload.get("relationships");
        if (relationships instanceof List<?> list) {
            for (Object item : list) {
                coordinator.stageGraphOp(handle,
                        new GraphOperation.UpsertRelationship(Relationship.fromPayload((Map<?, ?>) item)));
            }
        }
    }

    /**
     * A transaction committed after {@code event} that also wrote {@code side}.
     */
    private Optional<ChangeEvent> laterWriteOf(ChangeEvent event, StoreSide side) {
        List<ChangeEvent> history = ledger.history(event.entityId());
        boolean after = false;
        for (ChangeEvent candidate : history) {
            if (candidate.id().equals(event.id())) {
                after = true;
                continue;
            }
            if (after && candidate.status() == ChangeStatus.COMMITTED
                    && !candidate.transactionId().equals(event.transactionId())
                    && wrote(candidate, side)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean wrote(ChangeEvent event, StoreSide side) {
        return side == StoreSide.VECTOR
                ? event.payload().containsKey("content")
                : event.payload().containsKey("contentHash") || event.payload().containsKey("relationships");
    }

    private Outcome resolve(ChangeEvent event, Map<String, Object> resolution, Outcome outcome) {
        try {
            ledger.record(event.advance(ChangeStatus.COMMITTED, resolution));
        } catch (IllegalStateException e) {
            // resolved concurrently by another reconciler sharing the ledger
            log.debug("Transaction {} already resolved: {}", event.transactionId(), e.getMessage());
            return Outcome.SKIPPED;
        }
        metrics.incrementReconciliationResolved();
        log.info("reconciliation.resolved transactionId={} entityId={} resolution={}",
                event.transactionId(), event.entityId(), resolution.get("resolution"));
        return outcome;
    }

    private Outcome markFailed(ChangeEvent event) {
        try {
            ledger.record(event.advance(ChangeStatus.FAILED, Map.of("resolution", "unrecoverable")));
        } catch (IllegalStateException e) {
            log.debug("Transaction {} already resolved: {}", event.transactionId(), e.getMessage());
            return Outcome.SKIPPED;
        }
        return Outcome.FAILED;
    }

    private static Map<String, String> stringMap(Object value) {
        Map<String, String> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
        }
        return result;
    }
}
