package com.story.knowledge.core.exception;

import com.story.knowledge.core.model.StoreSide;

/**
 * A store adapter refused or failed an operation for a reason that retrying will not fix.
 */
public class StoreException extends KnowledgeBaseException {

    public StoreException(String message, StoreSide side) {
        super(message, null, null, side, null);
    }

    public StoreException(String message, StoreSide side, Throwable cause) {
        super(message, null, null, side, cause);
    }
}
