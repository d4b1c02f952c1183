package com.story.knowledge.chaos;

import com.story.knowledge.core.exception.StoreException;
import com.story.knowledge.core.exception.TransientStoreException;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.store.Deadline;
import com.story.knowledge.store.StagingToken;
import com.story.knowledge.store.VectorEntry;
import com.story.knowledge.store.VectorStoreAdapter;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator around a {@link VectorStoreAdapter} that injects configurable failures
 * into prepare, commit and discard.
 */
public class ChaosVectorStore implements VectorStoreAdapter {

    private final VectorStoreAdapter delegate;
    private final AtomicInteger transientPrepareFailures = new AtomicInteger(0);
    private final AtomicBoolean failPrepare = new AtomicBoolean(false);
    private final AtomicBoolean failCommit = new AtomicBoolean(false);
    private final AtomicBoolean failDiscard = new AtomicBoolean(false);
    private final AtomicInteger prepareCalls = new AtomicInteger(0);
    private final AtomicInteger commitCalls = new AtomicInteger(0);
    private volatile long prepareDelayMs = 0;

    public ChaosVectorStore(VectorStoreAdapter delegate) {
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
    }

    @Override
    public StagingToken prepareUpsert(VectorEntry entry, Deadline deadline) {
        prepareCalls.incrementAndGet();
        Chaos.sleep(prepareDelayMs);
        if (transientPrepareFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new TransientStoreException("ChaosVectorStore: simulated transient prepare failure", StoreSide.VECTOR);
        }
        if (failPrepare.get()) {
            throw new StoreException("ChaosVectorStore: simulated prepare failure", StoreSide.VECTOR);
        }
        return delegate.prepareUpsert(entry, deadline);
    }

    @Override
    public void commit(StagingToken token, Deadline deadline) {
        commitCalls.incrementAndGet();
        if (failCommit.get()) {
            throw new TransientStoreException("ChaosVectorStore: simulated commit failure", StoreSide.VECTOR);
        }
        delegate.commit(token, deadline);
    }

    @Override
    public void discard(StagingToken token) {
        if (failDiscard.get()) {
            throw new StoreException("ChaosVectorStore: simulated discard failure", StoreSide.VECTOR);
        }
        delegate.discard(token);
    }

    @Override
    public Optional<VectorEntry> find(EntityIdentifier id) {
        return delegate.find(id);
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
