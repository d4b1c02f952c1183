package com.story.knowledge.graph;

/**
 * FalkorDB endpoint and sizing of the {@link SimpleGraphConnectionPool}.
 *
 * <p>Every staged graph write holds a connection from prepare until commit or
 * discard, so {@code maxTotal} caps the number of transactions that can sit
 * between prepare and commit at once. Borrowers wait at most
 * {@code maxWaitMillis} (or their own deadline, whichever is shorter).</p>
 */
public class PoolConfig {

    private final String host;
    private final int port;
    private final String graphName;
    private final int maxTotal;
    private final int maxIdle;
    private final int minIdle;
    private final long maxWaitMillis;
    private final boolean testOnBorrow;

    private PoolConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.graphName = builder.graphName;
        this.maxTotal = builder.maxTotal;
        this.maxIdle = builder.maxIdle;
        this.minIdle = builder.minIdle;
        this.maxWaitMillis = builder.maxWaitMillis;
        this.testOnBorrow = builder.testOnBorrow;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /**
     * Graph holding story elements, identifier keys and ledger events.
     */
    public String getGraphName() {
        return graphName;
    }

    public int getMaxTotal() {
        return maxTotal;
    }

    public int getMaxIdle() {
        return maxIdle;
    }

    public int getMinIdle() {
        return minIdle;
    }

    public long getMaxWaitMillis() {
        return maxWaitMillis;
    }

    /**
     * Whether idle connections are pinged before being handed out again.
     */
    public boolean isTestOnBorrow() {
        return testOnBorrow;
    }

    /**
     * Default sizing against {@code localhost:6379}.
     */
    public static PoolConfig local(String graphName) {
        return builder().graphName(graphName).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String host = "localhost";
        private int port = 6379;
        private String graphName = "story-knowledge";
        private int maxTotal = 16;
        private int maxIdle = 8;
        private int minIdle = 0;
        private long maxWaitMillis = 5000;
        private boolean testOnBorrow = true;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder graphName(String graphName) {
            this.graphName = graphName;
            return this;
        }

        public Builder maxTotal(int maxTotal) {
            if (maxTotal <= 0) {
                throw new IllegalArgumentException("maxTotal must be > 0");
            }
            this.maxTotal = maxTotal;
            return this;
        }

        public Builder maxIdle(int maxIdle) {
            if (maxIdle < 0) {
                throw new IllegalArgumentException("maxIdle must be >= 0");
            }
            this.maxIdle = maxIdle;
            return this;
        }

        public Builder minIdle(int minIdle) {
            if (minIdle < 0) {
                throw new IllegalArgumentException("minIdle must be >= 0");
            }
            this.minIdle = minIdle;
            return this;
        }

        public Builder maxWaitMillis(long maxWaitMillis) {
            if (maxWaitMillis <= 0) {
                throw new IllegalArgumentException("maxWaitMillis must be > 0");
            }
            this.maxWaitMillis = maxWaitMillis;
            return this;
        }

        public Builder testOnBorrow(boolean testOnBorrow) {
            this.testOnBorrow = testOnBorrow;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the endpoint is incomplete or the
         *                                  idle bounds do not fit {@code maxTotal}
         */
        public PoolConfig build() {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host is required");
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port must be between 1 and 65535 (was " + port + ")");
            }
            if (graphName == null || graphName.isBlank()) {
                throw new IllegalArgumentException("graphName is required");
            }
            if (maxIdle > maxTotal) {
                throw new IllegalArgumentException("maxIdle cannot exceed maxTotal");
            }
            if (minIdle > maxIdle) {
                throw new IllegalArgumentException("minIdle cannot exceed maxIdle");
            }
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" + host + ":" + port + "/" + graphName +
                ", maxTotal=" + maxTotal +
                ", idle=" + minIdle + ".." + maxIdle +
                ", maxWaitMillis=" + maxWaitMillis +
                '}';
    }
}
