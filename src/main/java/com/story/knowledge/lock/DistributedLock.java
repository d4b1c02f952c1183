package com.story.knowledge.lock;

import java.time.Duration;

/**
 * Exclusive write lock per key, held by a transaction for its whole lifetime.
 *
 * <p>Ownership is not bound to a thread: a lock taken by {@code begin} on one thread
 * may be released by {@code commit} on another. Locks are not reentrant.</p>
 */
public interface DistributedLock {

    /**
     * Attempts to acquire the lock on {@code key}, waiting at most {@code maxWait}.
     *
     * @param key     the lock key (an entity identifier)
     * @param maxWait how long to wait; {@link Duration#ZERO} fails immediately when held
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the wait was interrupted
     */
    boolean tryLock(String key, Duration maxWait);

    /**
     * Releases the lock on {@code key}. Releasing a lock that is not held is a no-op.
     */
    void unlock(String key);

    /**
     * Whether some transaction currently holds {@code key}.
     */
    boolean isLocked(String key);
}
