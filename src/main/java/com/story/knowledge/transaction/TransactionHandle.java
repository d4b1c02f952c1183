package com.story.knowledge.transaction;

import com.story.knowledge.core.model.ChangeEvent;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.store.GraphOperation;
import com.story.knowledge.store.StagingToken;
import com.story.knowledge.store.VectorEntry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One open write against one entity, created by {@link TransactionCoordinator#begin}.
 *
 * <p>Holds the staged operations, the staging tokens returned by prepare and the
 * latest ledger event. A handle is used once: after it reaches a terminal state
 * every coordinator operation on it fails. All mutation goes through the
 * coordinator, which synchronizes on the handle.</p>
 */
public final class TransactionHandle {

    private final String id;
    private final EntityIdentifier entityId;
    private final long startNanos = System.nanoTime();
    private final List<GraphOperation> graphOperations = new ArrayList<>();
    private VectorEntry vectorEntry;
    private TransactionState state = TransactionState.INIT;
    private boolean prepared;
    private StagingToken graphToken;
    private StagingToken vectorToken;
    private ChangeEvent event;

    TransactionHandle(String id, EntityIdentifier entityId) {
        this.id = id;
        this.entityId = entityId;
    }

    public String getId() {
        return id;
    }

    public EntityIdentifier getEntityId() {
        return entityId;
    }

    public synchronized TransactionState getState() {
        return state;
    }

    /**
     * Whether both stores accepted their staged work.
     */
    public synchronized boolean isPrepared() {
        return prepared;
    }

    public synchronized List<GraphOperation> getGraphOperations() {
        return Collections.unmodifiableList(new ArrayList<>(graphOperations));
    }

    public synchronized Optional<VectorEntry> getVectorEntry() {
        return Optional.ofNullable(vectorEntry);
    }

    /**
     * Latest ledger event of this transaction; empty until something was ledgered.
     */
    public synchronized Optional<ChangeEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    boolean isEmpty() {
        return graphOperations.isEmpty() && vectorEntry == null;
    }

    void transitionTo(TransactionState next) {
        StateTransition.validate(state, next);
        state = next;
    }

    void addGraphOperation(GraphOperation operation) {
        graphOperations.add(operation);
    }

    /**
     * Both upserts target the entity's single point, so the latest entry replaces the previous one.
     */
    void setVectorEntry(VectorEntry entry) {
        this.vectorEntry = entry;
    }

    void markPrepared() {
        this.prepared = true;
    }

    StagingToken graphToken() {
        return graphToken;
    }

    void graphToken(StagingToken token) {
        this.graphToken = token;
    }

    StagingToken vectorToken() {
        return vectorToken;
    }

    void vectorToken(StagingToken token) {
        this.vectorToken = token;
    }

    void event(ChangeEvent event) {
        this.event = event;
    }

    Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public String toString() {
        return "TransactionHandle{id='" + id + "', entityId=" + entityId + ", state=" + state + '}';
    }
}
