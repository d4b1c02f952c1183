package com.story.knowledge.registry;

import com.story.knowledge.core.exception.StoreException;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * FalkorDB-backed implementation of {@link EntityIdentifierRegistry}.
 * Persists each mapping as an {@code :EntityKey} node.
 *
 * <p>{@code MERGE ... ON CREATE SET} keeps the first identifier written for a key,
 * across processes sharing the graph; a losing writer reads the winner's
 * identifier back from the same statement.</p>
 */
public class GraphEntityIdentifierRegistry implements EntityIdentifierRegistry {
    private static final Logger log = LoggerFactory.getLogger(GraphEntityIdentifierRegistry.class);

    private final GraphConnection connection;
    private final Supplier<EntityIdentifier> idGenerator;

    public GraphEntityIdentifierRegistry(GraphConnection connection) {
        this(connection, EntityIdentifier::generate);
    }

    public GraphEntityIdentifierRegistry(GraphConnection connection, Supplier<EntityIdentifier> idGenerator) {
        this.connection = connection;
        this.idGenerator = idGenerator;
        safeExecute("CREATE INDEX FOR (k:EntityKey) ON (k.naturalKey)");
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (Exception e) {
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public EntityIdentifier resolveOrCreate(NaturalKey key) {
        EntityIdentifier candidate = idGenerator.get();
        List<Map<String, Object>> rows = connection.query("""
                MERGE (k:EntityKey {naturalKey: $naturalKey})
                ON CREATE SET k.entityId = $candidate, k.createdAt = $createdAt
                RETURN k.entityId AS entityId
                """, Map.of(
                "naturalKey", key.value(),
                "candidate", candidate.value(),
                "createdAt", Instant.now().toString()));
        if (rows.isEmpty() || rows.get(0).get("entityId") == null) {
            throw new StoreException("Registry did not return an identifier for key " + key, StoreSide.GRAPH);
        }
        EntityIdentifier id = EntityIdentifier.of((String) rows.get(0).get("entityId"));
        if (id.equals(candidate)) {
            log.debug("Allocated identifier {} for key {}", id, key);
        }
        return id;
    }

    @Override
    public Optional<EntityIdentifier> find(NaturalKey key) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (k:EntityKey {naturalKey: $naturalKey})
                RETURN k.entityId AS entityId
                """, Map.of("naturalKey", key.value()));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(EntityIdentifier.of((String) rows.get(0).get("entityId")));
    }

    @Override
    public long size() {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (k:EntityKey)
                RETURN count(k) AS cnt
                """);
        if (rows.isEmpty()) {
            return 0;
        }
        return ((Number) rows.get(0).get("cnt")).longValue();
    }
}
