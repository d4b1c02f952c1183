package com.story.knowledge.core.model;

/**
 * Outcome of an attempted cross-store mutation.
 *
 * <p>Transitions are monotonic:</p>
 * <ul>
 *   <li>PENDING → COMMITTED | FAILED | ROLLED_BACK | RECONCILIATION_REQUIRED</li>
 *   <li>RECONCILIATION_REQUIRED → COMMITTED | FAILED</li>
 *   <li>COMMITTED, FAILED and ROLLED_BACK are terminal</li>
 * </ul>
 */
public enum ChangeStatus {
    PENDING,
    COMMITTED,
    FAILED,
    ROLLED_BACK,
    RECONCILIATION_REQUIRED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED || this == ROLLED_BACK;
    }

    public boolean canTransitionTo(ChangeStatus next) {
        return switch (this) {
            case PENDING -> next != PENDING;
            case RECONCILIATION_REQUIRED -> next == COMMITTED || next == FAILED;
            case COMMITTED, FAILED, ROLLED_BACK -> false;
        };
    }
}
