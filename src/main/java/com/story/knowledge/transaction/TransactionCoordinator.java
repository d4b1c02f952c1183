package com.story.knowledge.transaction;

import com.story.knowledge.core.exception.AbortedException;
import com.story.knowledge.core.exception.ConcurrencyConflictException;
import com.story.knowledge.core.exception.InvalidStateException;
import com.story.knowledge.core.exception.ReconciliationRequiredException;
import com.story.knowledge.core.exception.TransientStoreException;
import com.story.knowledge.core.exception.ValidationException;
import com.story.knowledge.core.model.ChangeEvent;
import com.story.knowledge.core.model.ChangeStatus;
import com.story.knowledge.core.model.ChangeType;
import com.story.knowledge.core.model.ContentHash;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.core.model.StoryElementNode;
import com.story.knowledge.core.model.TransactionPhase;
import com.story.knowledge.graph.InputSanitizer;
import com.story.knowledge.ledger.ChangeEventLedger;
import com.story.knowledge.lock.DistributedLock;
import com.story.knowledge.lock.LockAcquisitionException;
import com.story.knowledge.logging.LogContext;
import com.story.knowledge.metrics.MetricsService;
import com.story.knowledge.metrics.NoOpMetricsService;
import com.story.knowledge.store.Deadline;
import com.story.knowledge.store.GraphOperation;
import com.story.knowledge.store.GraphStoreAdapter;
import com.story.knowledge.store.StagingToken;
import com.story.knowledge.store.VectorEntry;
import com.story.knowledge.store.VectorStoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Applies one logical update to the graph store and the vector store as if it
 * were a single atomic operation.
 *
 * <p>Protocol: {@link #begin} locks the entity, {@code stage*} collect operations,
 * {@link #prepare} has both stores stage their work invisibly, {@link #commit}
 * makes it visible, graph store first and vector store second. A failure before
 * anything is visible discards both stages ({@link AbortedException}). A failure
 * after the graph store committed leaves the transaction
 * {@link TransactionState#PARTIALLY_COMMITTED} with a ledgered reconciliation
 * payload ({@link ReconciliationRequiredException}); the committed side is never
 * undone.</p>
 *
 * <p>Every state change that matters for audit is appended to the
 * {@link ChangeEventLedger}: PENDING when prepare starts, then exactly one of
 * COMMITTED, ROLLED_BACK or RECONCILIATION_REQUIRED.</p>
 *
 * <p>Thread-safe. Operations on one handle are serialized on the handle.</p>
 */
public class TransactionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TransactionCoordinator.class);

    private final GraphStoreAdapter graphStore;
    private final VectorStoreAdapter vectorStore;
    private final ChangeEventLedger ledger;
    private final DistributedLock lock;
    private final CoordinatorConfig config;
    private final MetricsService metrics;

    public TransactionCoordinator(GraphStoreAdapter graphStore, VectorStoreAdapter vectorStore,
                                  ChangeEventLedger ledger, DistributedLock lock, CoordinatorConfig config) {
        this(graphStore, vectorStore, ledger, lock, config, new NoOpMetricsService());
    }

    public TransactionCoordinator(GraphStoreAdapter graphStore, VectorStoreAdapter vectorStore,
                                  ChangeEventLedger ledger, DistributedLock lock, CoordinatorConfig config,
                                  MetricsService metrics) {
        this.graphStore = Objects.requireNonNull(graphStore, "graphStore is required");
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore is required");
        this.ledger = Objects.requireNonNull(ledger, "ledger is required");
        this.lock = Objects.requireNonNull(lock, "lock is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Opens a transaction on {@code entityId} and takes its write lock.
     *
     * @throws ConcurrencyConflictException if another open transaction holds the lock
     *                                      (immediately, or after the lock wait under {@link ConflictPolicy#WAIT})
     */
    public TransactionHandle begin(EntityIdentifier entityId) {
        if (entityId == null) {
            throw new ValidationException("Entity identifier is required");
        }
        Duration wait = config.conflictPolicy() == ConflictPolicy.FAIL_FAST ? Duration.ZERO : config.lockWait();
        boolean acquired;
        try {
            acquired = lock.tryLock(entityId.value(), wait);
        } catch (LockAcquisitionException e) {
            metrics.incrementLockConflict();
            throw new ConcurrencyConflictException(entityId, e);
        }
        if (!acquired) {
            metrics.incrementLockConflict();
            throw new ConcurrencyConflictException(entityId, null);
        }

        TransactionHandle handle = new TransactionHandle(UUID.randomUUID().toString(), entityId);
        handle.transitionTo(TransactionState.STAGING);
        log.debug("transaction.begin transactionId={} entityId={}", handle.getId(), entityId);
        return handle;
    }

    /**
     * Stages the vector upsert of the transaction's entity. A second call replaces the first.
     */
    public void stageVectorOp(TransactionHandle handle, VectorEntry entry) {
        synchronized (handle) {
            requireStaging(handle, "stage a vector operation");
            Objects.requireNonNull(entry, "entry is required");
            if (!entry.id().equals(handle.getEntityId())) {
                throw new ValidationException("Vector entry " + entry.id() + " is outside the transaction on "
                        + handle.getEntityId(), StoreSide.VECTOR);
            }
            InputSanitizer.validate(entry);
            handle.setVectorEntry(entry);
        }
    }

    /**
     * Appends a graph operation anchored on the transaction's entity.
     */
    public void stageGraphOp(TransactionHandle handle, GraphOperation operation) {
        synchronized (handle) {
            requireStaging(handle, "stage a graph operation");
            Objects.requireNonNull(operation, "operation is required");
            if (!operation.anchor().equals(handle.getEntityId())) {
                throw new ValidationException("Graph operation on " + operation.anchor()
                        + " is outside the transaction on " + handle.getEntityId(), StoreSide.GRAPH);
            }
            InputSanitizer.validate(operation);
            handle.addGraphOperation(operation);
        }
    }

    /**
     * Has each store with staged work validate and stage it without making it visible.
     * Transient failures are retried with backoff within the prepare deadline.
     *
     * @throws AbortedException                 if a store failed; nothing is staged anymore
     * @throws ReconciliationRequiredException  if staged work could not be discarded
     */
    public void prepare(TransactionHandle handle) {
        synchronized (handle) {
            requireState(handle, TransactionState.STAGING, TransactionPhase.PREPARE, "prepare");
            try (LogContext ignored = LogContext.forTransaction(handle.getId(), handle.getEntityId().value(), "prepare")) {
                handle.transitionTo(TransactionState.PREPARING);
                if (handle.isEmpty()) {
                    handle.markPrepared();
                    return;
                }

                ChangeEvent pending = newEvent(handle, ChangeStatus.PENDING, Map.of());
                try {
                    ledger.record(pending);
                } catch (RuntimeException e) {
                    log.error("ledger.write.failed status=PENDING: {}", e.getMessage());
                    handle.transitionTo(TransactionState.ABORTING);
                    finish(handle, TransactionState.ROLLED_BACK);
                    throw new AbortedException(handle.getEntityId(), TransactionPhase.PREPARE, null, e);
                }
                handle.event(pending);

                Deadline deadline = Deadline.after(config.prepareTimeout());
                if (!handle.getGraphOperations().isEmpty()) {
                    List<GraphOperation> operations = handle.getGraphOperations();
                    prepareSide(handle, StoreSide.GRAPH, deadline,
                            () -> graphStore.prepareWrite(operations, deadline));
                }
                if (handle.getVectorEntry().isPresent()) {
                    VectorEntry entry = handle.getVectorEntry().get();
                    prepareSide(handle, StoreSide.VECTOR, deadline,
                            () -> vectorStore.prepareUpsert(entry, deadline));
                }
                handle.markPrepared();
                log.debug("transaction.prepared graph={} vector={}", handle.graphToken() != null,
                        handle.vectorToken() != null);
            }
        }
    }

    /**
     * Commits a prepared transaction: graph store first, then vector store.
     *
     * @throws AbortedException                if the first commit failed; nothing became visible
     * @throws ReconciliationRequiredException if the graph store committed and the vector store did not
     */
    public CommitResult commit(TransactionHandle handle) {
        synchronized (handle) {
            requireState(handle, TransactionState.PREPARING, TransactionPhase.COMMIT, "commit");
            if (!handle.isPrepared()) {
                throw new InvalidStateException("Cannot commit transaction " + handle.getId()
                        + " before prepare succeeded", handle.getEntityId(), TransactionPhase.COMMIT);
            }
            try (LogContext ignored = LogContext.forTransaction(handle.getId(), handle.getEntityId().value(), "commit")) {
                handle.transitionTo(TransactionState.COMMITTING);
                if (handle.isEmpty()) {
                    finish(handle, TransactionState.COMMITTED);
                    return new CommitResult(handle.getId(), handle.getEntityId(), null);
                }

                Deadline deadline = Deadline.after(config.commitTimeout());
                boolean graphCommitted = false;
                if (handle.graphToken() != null) {
                    try {
                        if (deadline.isExpired()) {
                            throw new TransientStoreException("Commit deadline expired before graph commit",
                                    StoreSide.GRAPH);
                        }
                        graphStore.commit(handle.graphToken(), deadline);
                        handle.graphToken(null);
                        graphCommitted = true;
                    } catch (RuntimeException e) {
                        throw abort(handle, TransactionPhase.COMMIT, StoreSide.GRAPH, e);
                    }
                }
                if (handle.vectorToken() != null) {
                    try {
                        if (deadline.isExpired()) {
                            throw new TransientStoreException("Commit deadline expired before vector commit",
                                    StoreSide.VECTOR);
                        }
                        vectorStore.commit(handle.vectorToken(), deadline);
                        handle.vectorToken(null);
                    } catch (RuntimeException e) {
                        if (graphCommitted) {
                            throw partialCommit(handle, e);
                        }
                        throw abort(handle, TransactionPhase.COMMIT, StoreSide.VECTOR, e);
                    }
                }

                ChangeEvent committed = appendEvent(handle, ChangeStatus.COMMITTED, Map.of());
                finish(handle, TransactionState.COMMITTED);
                return new CommitResult(handle.getId(), handle.getEntityId(), committed);
            }
        }
    }

    /**
     * Discards whatever both stores staged. Valid before commit starts; rolling back a
     * rolled-back transaction is a no-op.
     *
     * @throws InvalidStateException           once commit has started or the transaction ended otherwise
     * @throws ReconciliationRequiredException if a store could not discard its stage
     */
    public void rollback(TransactionHandle handle) {
        synchronized (handle) {
            TransactionState state = handle.getState();
            if (state == TransactionState.ROLLED_BACK) {
                return;
            }
            if (state != TransactionState.STAGING && state != TransactionState.PREPARING) {
                throw new InvalidStateException("Cannot roll back transaction " + handle.getId() + " in state " + state,
                        handle.getEntityId(), TransactionPhase.ROLLBACK);
            }
            try (LogContext ignored = LogContext.forTransaction(handle.getId(), handle.getEntityId().value(), "rollback")) {
                handle.transitionTo(TransactionState.ABORTING);
                DiscardFailure failure = discardAll(handle);
                if (failure != null) {
                    throw rollbackFailed(handle, failure);
                }
                if (!handle.isEmpty()) {
                    appendEvent(handle, ChangeStatus.ROLLED_BACK, Map.of(
                            "phase", (state == TransactionState.STAGING ? TransactionPhase.STAGING
                                    : TransactionPhase.PREPARE).name(),
                            "reason", "requested"));
                }
                finish(handle, TransactionState.ROLLED_BACK);
            }
        }
    }

    public CoordinatorConfig getConfig() {
        return config;
    }

    private void prepareSide(TransactionHandle handle, StoreSide side, Deadline deadline,
                             Supplier<StagingToken> prepareCall) {
        StagingToken token;
        try {
            token = prepareWithRetry(side, deadline, prepareCall);
        } catch (RuntimeException e) {
            throw abort(handle, TransactionPhase.PREPARE, side, e);
        }
        if (side == StoreSide.GRAPH) {
            handle.graphToken(token);
        } else {
            handle.vectorToken(token);
        }
        if (deadline.isExpired()) {
            throw abort(handle, TransactionPhase.PREPARE, side,
                    new TransientStoreException("Prepare deadline expired", side));
        }
    }

    private StagingToken prepareWithRetry(StoreSide side, Deadline deadline, Supplier<StagingToken> prepareCall) {
        RetryPolicy retry = config.retryPolicy();
        int attempt = 1;
        while (true) {
            if (deadline.isExpired()) {
                throw new TransientStoreException("Prepare deadline expired before " + side + " prepare", side);
            }
            try {
                return prepareCall.get();
            } catch (TransientStoreException e) {
                if (attempt >= retry.maxAttempts()) {
                    throw e;
                }
                long delayMs = retry.backoff().calculate(attempt);
                if (deadline.remaining().toMillis() <= delayMs) {
                    throw e;
                }
                metrics.incrementPrepareRetry(side);
                log.warn("prepare.retry side={} attempt={} delayMs={} error={}", side, attempt, delayMs, e.getMessage());
                sleep(delayMs, side, e);
                attempt++;
            }
        }
    }

    private static void sleep(long delayMs, StoreSide side, TransientStoreException cause) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            TransientStoreException interrupted = new TransientStoreException(
                    "Interrupted while backing off " + side + " prepare", side, ie);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }

    /**
     * Nothing is visible yet: discard both stages and end ROLLED_BACK.
     */
    private RuntimeException abort(TransactionHandle handle, TransactionPhase phase, StoreSide failedSide,
                                   RuntimeException cause) {
        handle.transitionTo(TransactionState.ABORTING);
        metrics.incrementAborted(failedSide);
        log.warn("transaction.abort phase={} side={} error={}", phase, failedSide, cause.getMessage());

        DiscardFailure failure = discardAll(handle);
        if (failure != null) {
            ReconciliationRequiredException rollbackFailed = rollbackFailed(handle, failure);
            rollbackFailed.addSuppressed(cause);
            return rollbackFailed;
        }
        appendEvent(handle, ChangeStatus.ROLLED_BACK, Map.of(
                "phase", phase.name(),
                "failedSide", failedSide.name(),
                "error", String.valueOf(cause.getMessage())));
        finish(handle, TransactionState.ROLLED_BACK);
        return new AbortedException(handle.getEntityId(), phase, failedSide, cause);
    }

    /**
     * The graph store committed and the vector store did not. The graph side stays;
     * the ledger gets everything needed to complete the vector side.
     */
    private ReconciliationRequiredException partialCommit(TransactionHandle handle, RuntimeException cause) {
        metrics.incrementPartialCommit(StoreSide.VECTOR);
        log.error("transaction.partial committedSide=GRAPH failedSide=VECTOR error={}", cause.getMessage());

        StagingToken vectorToken = handle.vectorToken();
        if (vectorToken != null) {
            try {
                vectorStore.discard(vectorToken);
            } catch (RuntimeException e) {
                // reconciliation upserts by id, a leftover stage cannot corrupt it
                log.warn("Could not discard vector stage {} after partial commit: {}", vectorToken.id(), e.getMessage());
                cause.addSuppressed(e);
            }
            handle.vectorToken(null);
        }

        Appended appended = append(handle, ChangeStatus.RECONCILIATION_REQUIRED, Map.of(
                "phase", TransactionPhase.COMMIT.name(),
                "committedSide", StoreSide.GRAPH.name(),
                "failedSide", StoreSide.VECTOR.name(),
                "error", String.valueOf(cause.getMessage())));
        finish(handle, TransactionState.PARTIALLY_COMMITTED);
        return new ReconciliationRequiredException(
                "Graph store committed but vector store did not for " + handle.getEntityId(),
                handle.getEntityId(), TransactionPhase.COMMIT, StoreSide.GRAPH, StoreSide.VECTOR,
                appended.event(), cause, appended.failure());
    }

    private ReconciliationRequiredException rollbackFailed(TransactionHandle handle, DiscardFailure failure) {
        log.error("transaction.rollback_failed side={} error={}", failure.side(), failure.error().getMessage());
        Appended appended = append(handle, ChangeStatus.RECONCILIATION_REQUIRED, Map.of(
                "phase", TransactionPhase.ROLLBACK.name(),
                "failedSide", failure.side().name(),
                "error", String.valueOf(failure.error().getMessage())));
        finish(handle, TransactionState.ROLLBACK_FAILED);
        return new ReconciliationRequiredException(
                "Staged " + failure.side() + " work of " + handle.getEntityId() + " could not be discarded",
                handle.getEntityId(), TransactionPhase.ROLLBACK, null, failure.side(),
                appended.event(), failure.error(), appended.failure());
    }

    record DiscardFailure(StoreSide side, RuntimeException error) {
    }

    /**
     * Discards both tokens, attempting both even if the first fails.
     *
     * @return the first failure, or {@code null}
     */
    private DiscardFailure discardAll(TransactionHandle handle) {
        DiscardFailure failure = null;
        if (handle.graphToken() != null) {
            try {
                graphStore.discard(handle.graphToken());
                handle.graphToken(null);
            } catch (RuntimeException e) {
                log.error("Graph store failed to discard {}: {}", handle.graphToken().id(), e.getMessage());
                failure = new DiscardFailure(StoreSide.GRAPH, e);
            }
        }
        if (handle.vectorToken() != null) {
            try {
                vectorStore.discard(handle.vectorToken());
                handle.vectorToken(null);
            } catch (RuntimeException e) {
                log.error("Vector store failed to discard {}: {}", handle.vectorToken().id(), e.getMessage());
                if (failure == null) {
                    failure = new DiscardFailure(StoreSide.VECTOR, e);
                }
            }
        }
        return failure;
    }

    private void finish(TransactionHandle handle, TransactionState terminal) {
        handle.transitionTo(terminal);
        lock.unlock(handle.getEntityId().value());
        metrics.recordTransactionDuration(terminal.name(), handle.elapsed());
        if (terminal == TransactionState.COMMITTED || terminal == TransactionState.ROLLED_BACK) {
            log.info("transaction.finished transactionId={} entityId={} state={}", handle.getId(),
                    handle.getEntityId(), terminal);
        } else {
            log.error("transaction.finished transactionId={} entityId={} state={}", handle.getId(),
                    handle.getEntityId(), terminal);
        }
    }

    /**
     * An event and, when it could not be written, the ledger failure.
     */
    record Appended(ChangeEvent event, RuntimeException failure) {
    }

    private ChangeEvent appendEvent(TransactionHandle handle, ChangeStatus status, Map<String, Object> extra) {
        return append(handle, status, extra).event();
    }

    /**
     * Appends the successor of the handle's latest event, or a first event when
     * nothing was ledgered yet. A ledger failure is logged and returned with the
     * unpersisted event, so the outcome still reaches the caller.
     */
    private Appended append(TransactionHandle handle, ChangeStatus status, Map<String, Object> extra) {
        ChangeEvent event = handle.getEvent()
                .map(previous -> previous.advance(status, extra))
                .orElseGet(() -> newEvent(handle, status, extra));
        RuntimeException failure = null;
        try {
            ledger.record(event);
        } catch (RuntimeException e) {
            log.error("ledger.write.failed transactionId={} status={}: {}", handle.getId(), status, e.getMessage());
            failure = e;
        }
        handle.event(event);
        return new Appended(event, failure);
    }

    private ChangeEvent newEvent(TransactionHandle handle, ChangeStatus status, Map<String, Object> extra) {
        Map<String, Object> payload = reconciliationPayload(handle);
        payload.putAll(extra);
        return ChangeEvent.builder()
                .transactionId(handle.getId())
                .entityId(handle.getEntityId())
                .changeType(changeTypeOf(handle))
                .payload(payload)
                .status(status)
                .build();
    }

    /**
     * Everything needed to replay the staged writes idempotently. Never contains nulls.
     */
    static Map<String, Object> reconciliationPayload(TransactionHandle handle) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("entityId", handle.getEntityId().value());

        List<Map<String, Object>> relationships = new ArrayList<>();
        for (GraphOperation operation : handle.getGraphOperations()) {
            if (operation instanceof GraphOperation.UpsertNode upsert) {
                StoryElementNode node = upsert.node();
                if (node.getElementType() != null) {
                    payload.put("elementType", node.getElementType());
                }
                if (node.getContentHash() != null) {
                    payload.put("contentHash", node.getContentHash().value());
                }
            } else if (operation instanceof GraphOperation.UpsertRelationship upsert) {
                relationships.add(upsert.relationship().toPayload());
            }
        }
        payload.put("relationships", relationships);

        handle.getVectorEntry().ifPresent(entry -> {
            payload.put("content", entry.content());
            payload.put("metadata", new LinkedHashMap<>(entry.metadata()));
            payload.putIfAbsent("contentHash", ContentHash.of(entry.content()).value());
            String type = entry.metadata().get("type");
            if (type != null) {
                payload.putIfAbsent("elementType", type);
            }
        });
        return payload;
    }

    static ChangeType changeTypeOf(TransactionHandle handle) {
        if (handle.getVectorEntry().isPresent()) {
            return ChangeType.CONTENT;
        }
        boolean hasNode = handle.getGraphOperations().stream()
                .anyMatch(GraphOperation.UpsertNode.class::isInstance);
        return hasNode ? ChangeType.METADATA : ChangeType.RELATIONSHIP;
    }

    private void requireStaging(TransactionHandle handle, String action) {
        requireState(handle, TransactionState.STAGING, TransactionPhase.STAGING, action);
    }

    private void requireState(TransactionHandle handle, TransactionState expected, TransactionPhase phase,
                              String action) {
        Objects.requireNonNull(handle, "handle is required");
        if (handle.getState() != expected) {
            throw new InvalidStateException("Cannot " + action + " on transaction " + handle.getId()
                    + " in state " + handle.getState(), handle.getEntityId(), phase);
        }
    }
}
