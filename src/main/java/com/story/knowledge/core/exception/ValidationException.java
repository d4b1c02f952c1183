package com.story.knowledge.core.exception;

import com.story.knowledge.core.model.StoreSide;

/**
 * Malformed input. Never retried.
 */
public class ValidationException extends KnowledgeBaseException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, StoreSide side) {
        super(message, null, null, side, null);
    }
}
