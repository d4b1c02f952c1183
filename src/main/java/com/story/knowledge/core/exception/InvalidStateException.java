package com.story.knowledge.core.exception;

import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.TransactionPhase;

/**
 * An operation was invoked on a transaction handle in a state that does not allow it.
 */
public class InvalidStateException extends KnowledgeBaseException {

    public InvalidStateException(String message, EntityIdentifier entityId, TransactionPhase phase) {
        super(message, entityId, phase, null, null);
    }
}
