package com.story.knowledge.core.exception;

import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.core.model.TransactionPhase;

/**
 * Root of all errors raised by the knowledge base.
 *
 * <p>Carries as much context as is known where the error was raised: the entity
 * being written, the protocol phase and the offending store. Any of them may be
 * {@code null}.</p>
 */
public class KnowledgeBaseException extends RuntimeException {

    private final EntityIdentifier entityId;
    private final TransactionPhase phase;
    private final StoreSide side;

    public KnowledgeBaseException(String message) {
        this(message, null, null, null, null);
    }

    public KnowledgeBaseException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    public KnowledgeBaseException(String message, EntityIdentifier entityId, TransactionPhase phase,
                                  StoreSide side, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.phase = phase;
        this.side = side;
    }

    public EntityIdentifier getEntityId() {
        return entityId;
    }

    public TransactionPhase getPhase() {
        return phase;
    }

    public StoreSide getSide() {
        return side;
    }

    /**
     * Whether the caller may repeat the whole operation from scratch.
     * {@code true} means nothing became visible in either store.
     */
    public boolean isSafeToRetry() {
        return false;
    }
}
