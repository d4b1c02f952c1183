package com.story.knowledge.core.exception;

import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.TransactionPhase;

/**
 * Another open transaction holds the write lock on the entity.
 */
public class ConcurrencyConflictException extends KnowledgeBaseException {

    public ConcurrencyConflictException(EntityIdentifier entityId, Throwable cause) {
        super("Entity " + entityId + " is locked by another transaction", entityId, TransactionPhase.BEGIN, null, cause);
    }

    @Override
    public boolean isSafeToRetry() {
        return true;
    }
}
