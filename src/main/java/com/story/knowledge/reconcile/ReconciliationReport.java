package com.story.knowledge.reconcile;

/**
 * Outcome of one reconciliation sweep.
 *
 * @param examined   unresolved events looked at
 * @param reconciled events whose failed side was re-applied
 * @param superseded events resolved because a later write already covered them
 * @param failed     events whose re-drive failed; retried on the next sweep
 * @param skipped    events left alone: entity busy, or a rollback failure needing manual repair
 */
public record ReconciliationReport(int examined, int reconciled, int superseded, int failed, int skipped) {

    public int resolved() {
        return reconciled + superseded;
    }
}
