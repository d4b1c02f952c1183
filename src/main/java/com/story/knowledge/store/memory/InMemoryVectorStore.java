package com.story.knowledge.store.memory;

import com.story.knowledge.core.exception.StoreException;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.graph.InputSanitizer;
import com.story.knowledge.store.Deadline;
import com.story.knowledge.store.StagingToken;
import com.story.knowledge.store.VectorEntry;
import com.story.knowledge.store.VectorStoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory vector store. Entries are kept without embeddings; staged entries
 * stay invisible to {@link #find} until committed.
 */
public class InMemoryVectorStore implements VectorStoreAdapter {
    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private final ConcurrentMap<EntityIdentifier, VectorEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, VectorEntry> staged = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    @Override
    public StagingToken prepareUpsert(VectorEntry entry, Deadline deadline) {
        checkOpen();
        InputSanitizer.validate(entry);
        StagingToken token = StagingToken.newToken(StoreSide.VECTOR);
        staged.put(token.id(), entry);
        log.debug("Staged vector upsert for {} under token {}", entry.id(), token.id());
        return token;
    }

    @Override
    public void commit(StagingToken token, Deadline deadline) {
        checkOpen();
        VectorEntry entry = staged.remove(token.id());
        if (entry == null) {
            throw new StoreException("Unknown or already finished vector staging token " + token.id(), StoreSide.VECTOR);
        }
        entries.put(entry.id(), entry);
        log.debug("Upserted vector entry {}", entry.id());
    }

    @Override
    public void discard(StagingToken token) {
        if (staged.remove(token.id()) != null) {
            log.debug("Discarded vector staging token {}", token.id());
        }
    }

    @Override
    public Optional<VectorEntry> find(EntityIdentifier id) {
        return Optional.ofNullable(entries.get(id));
    }

    public int stagedCount() {
        return staged.size();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String getName() {
        return "in-memory-vector";
    }

    @Override
    public void close() {
        closed = true;
        staged.clear();
    }

    private void checkOpen() {
        if (closed) {
            throw new StoreException("Vector store is closed", StoreSide.VECTOR);
        }
    }
}
