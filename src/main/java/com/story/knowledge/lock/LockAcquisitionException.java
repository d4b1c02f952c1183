package com.story.knowledge.lock;

/**
 * Runtime exception thrown when waiting for a lock is interrupted.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
