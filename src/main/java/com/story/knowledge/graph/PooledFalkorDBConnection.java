package com.story.knowledge.graph;

import java.util.List;
import java.util.Map;

/**
 * {@link GraphConnection} facade that borrows a pooled connection per call.
 * Used by the identifier registry and the ledger, whose statements are
 * independent of each other; the graph store adapter borrows directly because
 * its connection must outlive a single call.
 */
public class PooledFalkorDBConnection implements GraphConnection {

    private final GraphConnectionPool pool;

    public PooledFalkorDBConnection(GraphConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        GraphConnection conn = pool.borrow();
        try {
            conn.execute(query, params);
        } finally {
            pool.release(conn);
        }
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        GraphConnection conn = pool.borrow();
        try {
            return conn.query(query, params);
        } finally {
            pool.release(conn);
        }
    }

    @Override
    public boolean isConnected() {
        GraphConnection conn = pool.borrow();
        try {
            return conn.isConnected();
        } finally {
            pool.release(conn);
        }
    }

    @Override
    public String getGraphName() {
        return pool.getGraphName();
    }

    @Override
    public void ensureIndexes() {
        GraphConnection conn = pool.borrow();
        try {
            conn.ensureIndexes();
        } finally {
            pool.release(conn);
        }
    }

    /**
     * The pool is shared with the graph store adapter and closed by its owner.
     */
    @Override
    public void close() {
    }
}
