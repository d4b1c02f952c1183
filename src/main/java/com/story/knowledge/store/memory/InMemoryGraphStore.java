package com.story.knowledge.store.memory;

import com.story.knowledge.core.exception.StoreException;
import com.story.knowledge.core.exception.ValidationException;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.Relationship;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.core.model.StoryElementNode;
import com.story.knowledge.graph.InputSanitizer;
import com.story.knowledge.store.Deadline;
import com.story.knowledge.store.GraphOperation;
import com.story.knowledge.store.GraphStoreAdapter;
import com.story.knowledge.store.StagingToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory graph store with real staging: staged operations live per token and
 * are invisible to {@link #findNode}/{@link #findRelationships} until committed.
 * Commits are applied atomically under a single monitor.
 */
public class InMemoryGraphStore implements GraphStoreAdapter {
    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private final Map<EntityIdentifier, StoryElementNode> nodes = new HashMap<>();
    private final Map<EntityIdentifier, Set<Relationship>> edgesBySource = new HashMap<>();
    private final ConcurrentMap<String, List<GraphOperation>> staged = new ConcurrentHashMap<>();
    private final Object monitor = new Object();
    private volatile boolean closed = false;

    @Override
    public StagingToken prepareWrite(List<GraphOperation> operations, Deadline deadline) {
        checkOpen();
        if (operations == null || operations.isEmpty()) {
            throw new ValidationException("No graph operations to stage", StoreSide.GRAPH);
        }
        operations.forEach(InputSanitizer::validate);

        StagingToken token = StagingToken.newToken(StoreSide.GRAPH);
        staged.put(token.id(), List.copyOf(operations));
        log.debug("Staged {} graph operation(s) under token {}", operations.size(), token.id());
        return token;
    }

    @Override
    public void commit(StagingToken token, Deadline deadline) {
        checkOpen();
        List<GraphOperation> operations = staged.remove(token.id());
        if (operations == null) {
            throw new StoreException("Unknown or already finished graph staging token " + token.id(), StoreSide.GRAPH);
        }
        synchronized (monitor) {
            for (GraphOperation operation : operations) {
                apply(operation);
            }
        }
        log.debug("Committed {} graph operation(s) for token {}", operations.size(), token.id());
    }

    @Override
    public void discard(StagingToken token) {
        if (staged.remove(token.id()) != null) {
            log.debug("Discarded graph staging token {}", token.id());
        }
    }

    @Override
    public Optional<StoryElementNode> findNode(EntityIdentifier id) {
        synchronized (monitor) {
            return Optional.ofNullable(nodes.get(id));
        }
    }

    @Override
    public List<Relationship> findRelationships(EntityIdentifier sourceId) {
        synchronized (monitor) {
            return new ArrayList<>(edgesBySource.getOrDefault(sourceId, Set.of()));
        }
    }

    /**
     * Number of tokens staged but neither committed nor discarded.
     */
    public int stagedCount() {
        return staged.size();
    }

    public int nodeCount() {
        synchronized (monitor) {
            return nodes.size();
        }
    }

    @Override
    public String getName() {
        return "in-memory-graph";
    }

    @Override
    public void close() {
        closed = true;
        staged.clear();
    }

    private void apply(GraphOperation operation) {
        if (operation instanceof GraphOperation.UpsertNode upsert) {
            StoryElementNode update = upsert.node();
            nodes.merge(update.getId(), update, StoryElementNode::merge);
        } else if (operation instanceof GraphOperation.UpsertRelationship upsert) {
            Relationship relationship = upsert.relationship();
            nodes.putIfAbsent(relationship.sourceId(), new StoryElementNode(relationship.sourceId(), null, null));
            nodes.putIfAbsent(relationship.targetId(), new StoryElementNode(relationship.targetId(), null, null));
            edgesBySource.computeIfAbsent(relationship.sourceId(), k -> new LinkedHashSet<>()).add(relationship);
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new StoreException("Graph store is closed", StoreSide.GRAPH);
        }
    }
}
