package com.story.knowledge.chaos;

import com.story.knowledge.core.exception.StoreException;
import com.story.knowledge.core.exception.TransientStoreException;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.Relationship;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.core.model.StoryElementNode;
import com.story.knowledge.store.Deadline;
import com.story.knowledge.store.GraphOperation;
import com.story.knowledge.store.GraphStoreAdapter;
import com.story.knowledge.store.StagingToken;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator around a {@link GraphStoreAdapter} that injects configurable failures
 * into prepare, commit and discard.
 */
public class ChaosGraphStore implements GraphStoreAdapter {

    private final GraphStoreAdapter delegate;
    private final AtomicInteger transientPrepareFailures = new AtomicInteger(0);
    private final AtomicBoolean failPrepare = new AtomicBoolean(false);
    private final AtomicBoolean failCommit = new AtomicBoolean(false);
    private final AtomicBoolean failDiscard = new AtomicBoolean(false);
    private final AtomicInteger prepareCalls = new AtomicInteger(0);
    private final AtomicInteger commitCalls = new AtomicInteger(0);
    private volatile long prepareDelayMs = 0;
    private volatile long commitDelayMs = 0;

    public ChaosGraphStore(GraphStoreAdapter delegate) {
        this.delegate = delegate;
    }

    /**
     * The next {@code n} prepare calls throw {@link TransientStoreException}.
     */
    public void failNextPrepares(int n) {
        transientPrepareFailures.set(n);
    }

    public void setFailPrepare(boolean fail) {
        failPrepare.set(fail);
    }

    public void setFailCommit(boolean fail) {
        failCommit.set(fail);
    }

    public void setFailDiscard(boolean fail) {
        failDiscard.set(fail);
    }

    public void setPrepareDelayMs(long delayMs) {
        this.prepareDelayMs = delayMs;
    }

    /**
     * Delays every commit after the delegate has applied it.
     */
    public void setCommitDelayMs(long delayMs) {
        this.commitDelayMs = delayMs;
    }

    public int prepareCalls() {
        return prepareCalls.get();
    }

    public int commitCalls() {
        return commitCalls.get();
    }

    public void reset() {
        transientPrepareFailures.set(0);
        failPrepare.set(false);
        failCommit.set(false);
        failDiscard.set(false);
        prepareDelayMs = 0;
        commitDelayMs = 0;
    }

    @Override
    public StagingToken prepareWrite(List<GraphOperation> operations, Deadline deadline) {
        prepareCalls.incrementAndGet();
        Chaos.sleep(prepareDelayMs);
        if (transientPrepareFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new TransientStoreException("ChaosGraphStore: simulated transient prepare failure", StoreSide.GRAPH);
        }
        if (failPrepare.get()) {
            throw new StoreException("ChaosGraphStore: simulated prepare failure", StoreSide.GRAPH);
        }
        return delegate.prepareWrite(operations, deadline);
    }

    @Override
    public void commit(StagingToken token, Deadline deadline) {
        commitCalls.incrementAndGet();
        if (failCommit.get()) {
            throw new TransientStoreException("ChaosGraphStore: simulated commit failure", StoreSide.GRAPH);
        }
        delegate.commit(token, deadline);
        Chaos.sleep(commitDelayMs);
    }

    @Override
    public void discard(StagingToken token) {
        if (failDiscard.get()) {
            throw new StoreException("ChaosGraphStore: simulated discard failure", StoreSide.GRAPH);
        }
        delegate.discard(token);
    }

    @Override
    public Optional<StoryElementNode> findNode(EntityIdentifier id) {
        return delegate.findNode(id);
    }

    @Override
    public List<Relationship> findRelationships(EntityIdentifier sourceId) {
        return delegate.findRelationships(sourceId);
    }

    @Override
    public String getName() {
        return "chaos:" + delegate.getName();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
