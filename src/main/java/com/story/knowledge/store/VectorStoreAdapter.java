package com.story.knowledge.store;

import com.story.knowledge.core.model.EntityIdentifier;

import java.util.Optional;

/**
 * Capability contract of the vector-embedding store as consumed by the
 * transaction coordinator. Same concurrency and error rules as
 * {@link GraphStoreAdapter}.
 */
public interface VectorStoreAdapter extends AutoCloseable {

    /**
     * Validates the entry and stages a batch containing it, without upserting.
     */
    StagingToken prepareUpsert(VectorEntry entry, Deadline deadline);

    /**
     * Upserts the staged batch by id. Repeating the upsert is harmless.
     */
    void commit(StagingToken token, Deadline deadline);

    void discard(StagingToken token);

    Optional<VectorEntry> find(EntityIdentifier id);

    String getName();

    @Override
    void close();
}
