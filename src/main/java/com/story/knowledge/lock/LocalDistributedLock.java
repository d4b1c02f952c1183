package com.story.knowledge.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * In-process lock using one fair single-permit {@link Semaphore} per key.
 * Suitable for single-JVM deployments. This is the default lock implementation.
 *
 * <p>A key's semaphore is kept only while some thread holds or waits for it, so
 * the map does not grow with the number of entities ever written.</p>
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();

    /**
     * Semaphore plus the number of threads holding or waiting for it. The count
     * is only changed inside {@code compute} calls on the owning key.
     */
    private static final class KeyLock {
        final Semaphore semaphore = new Semaphore(1, true);
        int users;
    }

    @Override
    public boolean tryLock(String key, Duration maxWait) {
        KeyLock lock = locks.compute(key, (k, existing) -> {
            KeyLock entry = existing != null ? existing : new KeyLock();
            entry.users++;
            return entry;
        });
        boolean acquired = false;
        try {
            acquired = maxWait.isZero()
                    ? lock.semaphore.tryAcquire()
                    : lock.semaphore.tryAcquire(maxWait.toMillis(), TimeUnit.MILLISECONDS);
            if (acquired) {
                log.debug("Lock acquired: {}", key);
            } else {
                log.debug("Lock busy: {}", key);
            }
            return acquired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        } finally {
            if (!acquired) {
                leave(key, lock);
            }
        }
    }

    @Override
    public void unlock(String key) {
        KeyLock lock = locks.get(key);
        // a second unlock must not mint an extra permit
        if (lock != null && lock.semaphore.availablePermits() == 0) {
            lock.semaphore.release();
            leave(key, lock);
            log.debug("Lock released: {}", key);
        }
    }

    @Override
    public boolean isLocked(String key) {
        KeyLock lock = locks.get(key);
        return lock != null && lock.semaphore.availablePermits() == 0;
    }

    /**
     * Keys with a holder or a waiter.
     */
    int trackedKeys() {
        return locks.size();
    }

    private void leave(String key, KeyLock lock) {
        locks.computeIfPresent(key, (k, current) -> {
            if (current != lock) {
                return current;
            }
            current.users--;
            return current.users == 0 ? null : current;
        });
    }
}
