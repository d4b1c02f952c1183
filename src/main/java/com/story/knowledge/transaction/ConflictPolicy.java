package com.story.knowledge.transaction;

/**
 * What {@code begin} does when another open transaction holds the entity lock.
 */
public enum ConflictPolicy {
    /** Fail immediately with a concurrency conflict. */
    FAIL_FAST,
    /** Queue behind the holder (FIFO) for up to the configured lock wait. */
    WAIT
}
