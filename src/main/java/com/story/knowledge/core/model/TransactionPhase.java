package com.story.knowledge.core.model;

/**
 * Phase of the coordinator protocol in which something happened.
 */
public enum TransactionPhase {
    BEGIN,
    STAGING,
    PREPARE,
    COMMIT,
    ROLLBACK
}
