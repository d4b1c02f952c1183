package com.story.knowledge.transaction;

/**
 * Lifecycle of a {@link TransactionHandle}.
 *
 * <pre>
 * INIT -> STAGING -> PREPARING -> COMMITTING -> COMMITTED
 *                                            -> PARTIALLY_COMMITTED
 *                 \-> ABORTING -> ROLLED_BACK
 *                              -> ROLLBACK_FAILED
 * </pre>
 */
public enum TransactionState {
    INIT,
    STAGING,
    PREPARING,
    COMMITTING,
    COMMITTED,
    ABORTING,
    ROLLED_BACK,
    /** One store committed and the other did not. Needs reconciliation. */
    PARTIALLY_COMMITTED,
    /** Staged work could not be discarded. Needs manual reconciliation. */
    ROLLBACK_FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK
                || this == PARTIALLY_COMMITTED || this == ROLLBACK_FAILED;
    }
}
