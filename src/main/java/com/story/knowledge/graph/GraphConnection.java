package com.story.knowledge.graph;

import java.util.List;
import java.util.Map;

/**
 * A single connection to the graph database.
 * Not thread-safe: one caller at a time, which the pool guarantees.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     * The statement is applied atomically by the database.
     *
     * @param query  the Cypher statement
     * @param params statement parameters, referenced as {@code $name}
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows.
     *
     * @return one map per row, keyed by the RETURN aliases
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    /**
     * Round-trips a trivial query.
     */
    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes used by story element, identifier and ledger lookups.
     * Existing indexes are left alone.
     */
    void ensureIndexes();

    @Override
    void close();
}
