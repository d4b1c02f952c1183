package com.story.knowledge.core.exception;

import com.story.knowledge.core.model.StoreSide;

/**
 * Network or timeout failure talking to a store. Retried with backoff during prepare.
 */
public class TransientStoreException extends StoreException {

    public TransientStoreException(String message, StoreSide side) {
        super(message, side);
    }

    public TransientStoreException(String message, StoreSide side, Throwable cause) {
        super(message, side, cause);
    }
}
