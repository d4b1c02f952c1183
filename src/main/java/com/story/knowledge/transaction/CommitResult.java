package com.story.knowledge.transaction;

import com.story.knowledge.core.model.ChangeEvent;
import com.story.knowledge.core.model.EntityIdentifier;

/**
 * Outcome of a successful commit.
 *
 * @param transactionId the committed transaction
 * @param entityId      the entity it wrote
 * @param event         the COMMITTED ledger event, {@code null} for a transaction with nothing staged
 */
public record CommitResult(String transactionId, EntityIdentifier entityId, ChangeEvent event) {
}
