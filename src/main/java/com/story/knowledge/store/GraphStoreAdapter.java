package com.story.knowledge.store;

import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.Relationship;
import com.story.knowledge.core.model.StoryElementNode;

import java.util.List;
import java.util.Optional;

/**
 * Capability contract of the relationship/graph store as consumed by the
 * transaction coordinator.
 *
 * <p>Implementations are shared by all transactions and must be safe for
 * concurrent use. The native transaction or connection behind a
 * {@link StagingToken} belongs to the token until {@link #commit} or
 * {@link #discard} returns.</p>
 *
 * <p>Failures are reported as {@link com.story.knowledge.core.exception.ValidationException}
 * (bad operations, never retried), {@link com.story.knowledge.core.exception.TransientStoreException}
 * (network/timeout) or {@link com.story.knowledge.core.exception.StoreException}.</p>
 */
public interface GraphStoreAdapter extends AutoCloseable {

    /**
     * Validates and stages the operations without making them visible to readers.
     */
    StagingToken prepareWrite(List<GraphOperation> operations, Deadline deadline);

    /**
     * Makes the staged operations visible, atomically. A failed commit leaves
     * nothing of the token visible.
     */
    void commit(StagingToken token, Deadline deadline);

    /**
     * Throws the staged operations away. Discarding an unknown or already
     * discarded token is a no-op.
     */
    void discard(StagingToken token);

    Optional<StoryElementNode> findNode(EntityIdentifier id);

    /**
     * Committed edges leaving {@code sourceId}.
     */
    List<Relationship> findRelationships(EntityIdentifier sourceId);

    String getName();

    @Override
    void close();
}
