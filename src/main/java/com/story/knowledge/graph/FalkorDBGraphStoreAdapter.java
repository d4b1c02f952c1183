package com.story.knowledge.graph;

import com.story.knowledge.core.exception.KnowledgeBaseException;
import com.story.knowledge.core.exception.StoreException;
import com.story.knowledge.core.exception.TransientStoreException;
import com.story.knowledge.core.exception.ValidationException;
import com.story.knowledge.core.model.ContentHash;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.Relationship;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.core.model.StoryElementNode;
import com.story.knowledge.store.Deadline;
import com.story.knowledge.store.GraphOperation;
import com.story.knowledge.store.GraphStoreAdapter;
import com.story.knowledge.store.StagingToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Graph store adapter backed by FalkorDB.
 *
 * <p>{@link #prepareWrite} validates the operations, reserves a pooled connection
 * for the token and compiles them into a single MERGE statement. FalkorDB runs a
 * single query atomically, so {@link #commit} either applies every operation of
 * the token or none. Nothing is sent to the database before commit.</p>
 *
 * <p>Every clause is a MERGE keyed by node id or by the (source, target, type)
 * triple, so re-running a statement is harmless.</p>
 */
public class FalkorDBGraphStoreAdapter implements GraphStoreAdapter {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBGraphStoreAdapter.class);

    private final GraphConnectionPool pool;
    private final ConcurrentMap<String, StagedStatement> staged = new ConcurrentHashMap<>();

    public FalkorDBGraphStoreAdapter(GraphConnectionPool pool) {
        this.pool = pool;
    }

    /**
     * A compiled statement and the connection reserved to run it.
     */
    record StagedStatement(GraphConnection connection, String query, Map<String, Object> params, int operations) {
    }

    @Override
    public StagingToken prepareWrite(List<GraphOperation> operations, Deadline deadline) {
        if (operations == null || operations.isEmpty()) {
            throw new ValidationException("No graph operations to stage", StoreSide.GRAPH);
        }
        operations.forEach(InputSanitizer::validate);

        GraphConnection connection = pool.borrow(deadline.remaining());
        try {
            if (!connection.isConnected()) {
                throw new TransientStoreException("Graph store " + pool.getGraphName() + " is unreachable",
                        StoreSide.GRAPH);
            }
            Map<String, Object> params = new LinkedHashMap<>();
            String query = compile(operations, params);

            StagingToken token = StagingToken.newToken(StoreSide.GRAPH);
            staged.put(token.id(), new StagedStatement(connection, query, params, operations.size()));
            log.debug("Staged {} graph operation(s) under token {}", operations.size(), token.id());
            return token;
        } catch (RuntimeException e) {
            pool.release(connection);
            throw e;
        }
    }

    @Override
    public void commit(StagingToken token, Deadline deadline) {
        StagedStatement statement = staged.remove(token.id());
        if (statement == null) {
            throw new StoreException("Unknown or already finished graph staging token " + token.id(), StoreSide.GRAPH);
        }
        try {
            if (deadline.isExpired()) {
                throw new TransientStoreException("Deadline expired before graph commit", StoreSide.GRAPH);
            }
            statement.connection().execute(statement.query(), statement.params());
            log.debug("Committed {} graph operation(s) for token {}", statement.operations(), token.id());
        } catch (KnowledgeBaseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreException("Graph commit failed: " + e.getMessage(), StoreSide.GRAPH, e);
        } finally {
            pool.release(statement.connection());
        }
    }

    @Override
    public void discard(StagingToken token) {
        StagedStatement statement = staged.remove(token.id());
        if (statement != null) {
            pool.release(statement.connection());
            log.debug("Discarded graph staging token {}", token.id());
        }
    }

    @Override
    public Optional<StoryElementNode> findNode(EntityIdentifier id) {
        List<Map<String, Object>> rows = query("""
                MATCH (n:StoryElement {id: $id})
                RETURN n.id AS id, n.type AS type, n.contentHash AS contentHash
                """, Map.of("id", id.value()));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> row = rows.get(0);
        Object hash = row.get("contentHash");
        return Optional.of(new StoryElementNode(
                id,
                (String) row.get("type"),
                hash != null ? new ContentHash(hash.toString()) : null));
    }

    @Override
    public List<Relationship> findRelationships(EntityIdentifier sourceId) {
        List<Map<String, Object>> rows = query("""
                MATCH (s:StoryElement {id: $id})-[r]->(t:StoryElement)
                RETURN type(r) AS type, t.id AS target
                """, Map.of("id", sourceId.value()));
        List<Relationship> relationships = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            relationships.add(Relationship.of(sourceId,
                    EntityIdentifier.of((String) row.get("target")),
                    (String) row.get("type")));
        }
        return relationships;
    }

    @Override
    public String getName() {
        return "falkordb:" + pool.getGraphName();
    }

    /**
     * Releases every reserved connection and closes the pool.
     */
    @Override
    public void close() {
        for (String tokenId : List.copyOf(staged.keySet())) {
            StagedStatement statement = staged.remove(tokenId);
            if (statement != null) {
                pool.release(statement.connection());
            }
        }
        pool.close();
    }

    /**
     * Tokens whose connection is still reserved.
     */
    int stagedCount() {
        return staged.size();
    }

    /**
     * Compiles the operations into one statement. Variables and parameters are
     * suffixed with the operation index; parameter names end in a word, never a
     * digit, so no name is a prefix of another.
     */
    static String compile(List<GraphOperation> operations, Map<String, Object> params) {
        StringBuilder cypher = new StringBuilder();
        for (int i = 0; i < operations.size(); i++) {
            GraphOperation operation = operations.get(i);
            if (operation instanceof GraphOperation.UpsertNode upsert) {
                appendNode(cypher, i, upsert.node(), params);
            } else if (operation instanceof GraphOperation.UpsertRelationship upsert) {
                appendRelationship(cypher, i, upsert.relationship(), params);
            }
        }
        return cypher.toString().trim();
    }

    private static void appendNode(StringBuilder cypher, int i, StoryElementNode node, Map<String, Object> params) {
        String var = "n" + i;
        params.put(var + "_id", node.getId().value());
        cypher.append("MERGE (").append(var).append(":StoryElement {id: $").append(var).append("_id})\n");

        List<String> assignments = new ArrayList<>();
        if (node.getElementType() != null) {
            params.put(var + "_type", node.getElementType());
            assignments.add(var + ".type = $" + var + "_type");
        }
        if (node.getContentHash() != null) {
            params.put(var + "_hash", node.getContentHash().value());
            assignments.add(var + ".contentHash = $" + var + "_hash");
        }
        if (!assignments.isEmpty()) {
            cypher.append("SET ").append(String.join(", ", assignments)).append('\n');
        }
    }

    private static void appendRelationship(StringBuilder cypher, int i, Relationship relationship,
                                           Map<String, Object> params) {
        String source = "s" + i;
        String target = "t" + i;
        String prefix = "r" + i;
        params.put(prefix + "_source", relationship.sourceId().value());
        params.put(prefix + "_target", relationship.targetId().value());
        cypher.append("MERGE (").append(source).append(":StoryElement {id: $").append(prefix).append("_source})\n")
                .append("MERGE (").append(target).append(":StoryElement {id: $").append(prefix).append("_target})\n")
                // type is restricted to [A-Za-z0-9_] by InputSanitizer
                .append("MERGE (").append(source).append(")-[:").append(relationship.type()).append("]->(")
                .append(target).append(")\n");
    }

    private List<Map<String, Object>> query(String cypher, Map<String, Object> params) {
        GraphConnection connection = pool.borrow();
        try {
            return connection.query(cypher, params);
        } catch (KnowledgeBaseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreException("Graph read failed: " + e.getMessage(), StoreSide.GRAPH, e);
        } finally {
            pool.release(connection);
        }
    }
}
