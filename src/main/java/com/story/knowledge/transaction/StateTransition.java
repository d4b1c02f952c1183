package com.story.knowledge.transaction;

/**
 * Allowed transitions between {@link TransactionState}s.
 * Terminal states have no successors and no transition goes backwards.
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean isAllowed(TransactionState from, TransactionState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case INIT -> to == TransactionState.STAGING;
            case STAGING -> to == TransactionState.PREPARING || to == TransactionState.ABORTING;
            case PREPARING -> to == TransactionState.COMMITTING || to == TransactionState.ABORTING;
            case COMMITTING -> to == TransactionState.COMMITTED
                    || to == TransactionState.PARTIALLY_COMMITTED
                    || to == TransactionState.ABORTING;
            case ABORTING -> to == TransactionState.ROLLED_BACK || to == TransactionState.ROLLBACK_FAILED;
            case COMMITTED, ROLLED_BACK, PARTIALLY_COMMITTED, ROLLBACK_FAILED -> false;
        };
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public static void validate(TransactionState from, TransactionState to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(String.format("Invalid transaction state transition: %s -> %s", from, to));
        }
    }
}
