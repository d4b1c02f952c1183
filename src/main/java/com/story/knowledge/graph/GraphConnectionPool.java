package com.story.knowledge.graph;

import java.time.Duration;

/**
 * Bounded pool of {@link GraphConnection}s. A borrowed connection belongs to the
 * borrower until it is released.
 */
public interface GraphConnectionPool extends AutoCloseable {

    /**
     * Borrows a connection, waiting at most the pool's configured max wait.
     *
     * @throws com.story.knowledge.core.exception.TransientStoreException if none frees up in time
     * @throws IllegalStateException if the pool is closed
     */
    GraphConnection borrow();

    /**
     * Borrows a connection, waiting at most {@code maxWait} (capped by the pool's max wait).
     */
    GraphConnection borrow(Duration maxWait);

    void release(GraphConnection connection);

    /**
     * Connections currently borrowed.
     */
    int activeCount();

    int idleCount();

    String getGraphName();

    @Override
    void close();
}
