package com.story.knowledge.api;

import com.story.knowledge.transaction.BackoffCalculator;
import com.story.knowledge.transaction.ConflictPolicy;
import com.story.knowledge.transaction.CoordinatorConfig;
import com.story.knowledge.transaction.RetryPolicy;

import java.time.Duration;

/**
 * Options for a {@link UnifiedKnowledgeBase}: transaction deadlines, retries,
 * locking and async execution.
 */
public class KnowledgeBaseOptions {

    private static final Duration DEFAULT_PREPARE_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_COMMIT_TIMEOUT = Duration.ofSeconds(10);
    private static final int DEFAULT_MAX_PREPARE_ATTEMPTS = 3;
    private static final long DEFAULT_BACKOFF_BASE_MS = 50;
    private static final long DEFAULT_BACKOFF_MAX_MS = 1000;
    private static final double DEFAULT_BACKOFF_JITTER = 0.2;
    private static final Duration DEFAULT_LOCK_WAIT = Duration.ofSeconds(5);
    private static final int DEFAULT_ASYNC_POOL_SIZE = 8;
    private static final Duration DEFAULT_ASYNC_TIMEOUT = Duration.ofSeconds(30);

    private final Duration prepareTimeout;
    private final Duration commitTimeout;
    private final int maxPrepareAttempts;
    private final long backoffBaseMs;
    private final long backoffMaxMs;
    private final double backoffJitter;
    private final ConflictPolicy conflictPolicy;
    private final Duration lockWait;
    private final int asyncPoolSize;
    private final Duration asyncTimeout;
    private final long identifierCacheSize;

    private KnowledgeBaseOptions(Builder builder) {
        this.prepareTimeout = builder.prepareTimeout;
        this.commitTimeout = builder.commitTimeout;
        this.maxPrepareAttempts = builder.maxPrepareAttempts;
        this.backoffBaseMs = builder.backoffBaseMs;
        this.backoffMaxMs = builder.backoffMaxMs;
        this.backoffJitter = builder.backoffJitter;
        this.conflictPolicy = builder.conflictPolicy;
        this.lockWait = builder.lockWait;
        this.asyncPoolSize = builder.asyncPoolSize;
        this.asyncTimeout = builder.asyncTimeout;
        this.identifierCacheSize = builder.identifierCacheSize;
    }

    public Duration getPrepareTimeout() {
        return prepareTimeout;
    }

    public Duration getCommitTimeout() {
        return commitTimeout;
    }

    public int getMaxPrepareAttempts() {
        return maxPrepareAttempts;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public long getBackoffMaxMs() {
        return backoffMaxMs;
    }

    public double getBackoffJitter() {
        return backoffJitter;
    }

    public ConflictPolicy getConflictPolicy() {
        return conflictPolicy;
    }

    public Duration getLockWait() {
        return lockWait;
    }

    public int getAsyncPoolSize() {
        return asyncPoolSize;
    }

    public Duration getAsyncTimeout() {
        return asyncTimeout;
    }

    /**
     * Maximum number of cached identifier lookups, 0 disables the cache.
     */
    public long getIdentifierCacheSize() {
        return identifierCacheSize;
    }

    public CoordinatorConfig toCoordinatorConfig() {
        return new CoordinatorConfig(prepareTimeout, commitTimeout,
                new RetryPolicy(maxPrepareAttempts, new BackoffCalculator(backoffBaseMs, backoffMaxMs, backoffJitter)),
                conflictPolicy, lockWait);
    }

    public static KnowledgeBaseOptions defaults() {
        return builder().build();
    }

    /**
     * Options that refuse to queue behind a locked entity.
     */
    public static KnowledgeBaseOptions failFast() {
        return builder().conflictPolicy(ConflictPolicy.FAIL_FAST).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration prepareTimeout = DEFAULT_PREPARE_TIMEOUT;
        private Duration commitTimeout = DEFAULT_COMMIT_TIMEOUT;
        private int maxPrepareAttempts = DEFAULT_MAX_PREPARE_ATTEMPTS;
        private long backoffBaseMs = DEFAULT_BACKOFF_BASE_MS;
        private long backoffMaxMs = DEFAULT_BACKOFF_MAX_MS;
        private double backoffJitter = DEFAULT_BACKOFF_JITTER;
        private ConflictPolicy conflictPolicy = ConflictPolicy.WAIT;
        private Duration lockWait = DEFAULT_LOCK_WAIT;
        private int asyncPoolSize = DEFAULT_ASYNC_POOL_SIZE;
        private Duration asyncTimeout = DEFAULT_ASYNC_TIMEOUT;
        private long identifierCacheSize = 0;

        public Builder prepareTimeout(Duration prepareTimeout) {
            this.prepareTimeout = requirePositive(prepareTimeout, "prepareTimeout");
            return this;
        }

        public Builder commitTimeout(Duration commitTimeout) {
            this.commitTimeout = requirePositive(commitTimeout, "commitTimeout");
            return this;
        }

        public Builder maxPrepareAttempts(int maxPrepareAttempts) {
            if (maxPrepareAttempts < 1) {
                throw new IllegalArgumentException("maxPrepareAttempts must be >= 1");
            }
            this.maxPrepareAttempts = maxPrepareAttempts;
            return this;
        }

        public Builder backoff(long baseMs, long maxMs, double jitter) {
            // validated eagerly with the same rules used at runtime
            new BackoffCalculator(baseMs, maxMs, jitter);
            this.backoffBaseMs = baseMs;
            this.backoffMaxMs = maxMs;
            this.backoffJitter = jitter;
            return this;
        }

        public Builder conflictPolicy(ConflictPolicy conflictPolicy) {
            if (conflictPolicy == null) {
                throw new IllegalArgumentException("conflictPolicy is required");
            }
            this.conflictPolicy = conflictPolicy;
            return this;
        }

        public Builder lockWait(Duration lockWait) {
            this.lockWait = requirePositive(lockWait, "lockWait");
            return this;
        }

        public Builder asyncPoolSize(int asyncPoolSize) {
            if (asyncPoolSize <= 0) {
                throw new IllegalArgumentException("asyncPoolSize must be positive");
            }
            this.asyncPoolSize = asyncPoolSize;
            return this;
        }

        public Builder asyncTimeout(Duration asyncTimeout) {
            this.asyncTimeout = requirePositive(asyncTimeout, "asyncTimeout");
            return this;
        }

        public Builder identifierCacheSize(long identifierCacheSize) {
            if (identifierCacheSize < 0) {
                throw new IllegalArgumentException("identifierCacheSize must be >= 0");
            }
            this.identifierCacheSize = identifierCacheSize;
            return this;
        }

        public KnowledgeBaseOptions build() {
            return new KnowledgeBaseOptions(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
