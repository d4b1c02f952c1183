package com.story.knowledge.core.exception;

import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.core.model.TransactionPhase;

/**
 * A store failed before anything was committed. Staged work on both sides was
 * discarded and the transaction ended ROLLED_BACK, so the whole operation can be
 * retried from scratch.
 */
public class AbortedException extends KnowledgeBaseException {

    public AbortedException(EntityIdentifier entityId, TransactionPhase phase, StoreSide side, Throwable cause) {
        super("Transaction for " + entityId + " aborted in " + phase + ": "
                + (side != null ? side + " store failed" : "change ledger unavailable")
                + (cause != null ? " (" + cause.getMessage() + ")" : ""), entityId, phase, side, cause);
    }

    @Override
    public boolean isSafeToRetry() {
        return true;
    }
}
