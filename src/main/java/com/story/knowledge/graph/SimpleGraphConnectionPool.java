package com.story.knowledge.graph;

import com.story.knowledge.core.exception.TransientStoreException;
import com.story.knowledge.core.model.StoreSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Thread-safe connection pool using a fair {@link Semaphore} for flow control
 * and a {@link ConcurrentLinkedDeque} of idle connections.
 *
 * <p>JFalkorDB's {@code Graph} is not thread-safe, so every borrower gets its own
 * connection. The permit count caps concurrent graph transactions.</p>
 */
public class SimpleGraphConnectionPool implements GraphConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(SimpleGraphConnectionPool.class);

    private final PoolConfig config;
    private final Supplier<GraphConnection> connectionFactory;
    private final Semaphore permits;
    private final ConcurrentLinkedDeque<GraphConnection> idleConnections = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SimpleGraphConnectionPool(PoolConfig config) {
        this(config, () -> new FalkorDBConnection(config.getHost(), config.getPort(), config.getGraphName()));
    }

    public SimpleGraphConnectionPool(PoolConfig config, Supplier<GraphConnection> connectionFactory) {
        this.config = config;
        this.connectionFactory = connectionFactory;
        this.permits = new Semaphore(config.getMaxTotal(), true);

        for (int i = 0; i < config.getMinIdle(); i++) {
            try {
                idleConnections.addLast(connectionFactory.get());
            } catch (Exception e) {
                log.warn("Failed to pre-create connection {}/{}: {}", i + 1, config.getMinIdle(), e.getMessage());
            }
        }
        log.info("Graph connection pool initialized: {}", config);
    }

    @Override
    public GraphConnection borrow() {
        return borrow(Duration.ofMillis(config.getMaxWaitMillis()));
    }

    @Override
    public GraphConnection borrow(Duration maxWait) {
        if (closed.get()) {
            throw new IllegalStateException("Pool is closed");
        }
        long waitMillis = Math.min(maxWait.toMillis(), config.getMaxWaitMillis());
        try {
            if (!permits.tryAcquire(waitMillis, TimeUnit.MILLISECONDS)) {
                throw new TransientStoreException(
                        "Timed out after " + waitMillis + "ms waiting for a graph connection", StoreSide.GRAPH);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while waiting for a graph connection", StoreSide.GRAPH, e);
        }

        try {
            GraphConnection conn = idleConnections.pollFirst();
            if (conn != null && config.isTestOnBorrow() && !conn.isConnected()) {
                log.debug("Idle connection failed validation, replacing it");
                closeQuietly(conn);
                conn = null;
            }
            if (conn == null) {
                conn = connectionFactory.get();
            }
            log.debug("Connection borrowed (active={}, idle={})", activeCount(), idleConnections.size());
            return conn;
        } catch (RuntimeException e) {
            permits.release();
            throw new TransientStoreException("Could not open a graph connection: " + e.getMessage(),
                    StoreSide.GRAPH, e);
        }
    }

    @Override
    public void release(GraphConnection connection) {
        if (connection == null) {
            return;
        }
        if (closed.get() || idleConnections.size() >= config.getMaxIdle()) {
            closeQuietly(connection);
        } else {
            idleConnections.addLast(connection);
        }
        permits.release();
    }

    @Override
    public int activeCount() {
        return config.getMaxTotal() - permits.availablePermits();
    }

    @Override
    public int idleCount() {
        return idleConnections.size();
    }

    @Override
    public String getGraphName() {
        return config.getGraphName();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            GraphConnection conn;
            while ((conn = idleConnections.pollFirst()) != null) {
                closeQuietly(conn);
            }
            log.info("Graph connection pool closed");
        }
    }

    private void closeQuietly(GraphConnection connection) {
        try {
            connection.close();
        } catch (Exception e) {
            log.warn("Error closing graph connection: {}", e.getMessage());
        }
    }
}
