package com.story.knowledge.ledger;

import com.story.knowledge.core.model.ChangeEvent;
import com.story.knowledge.core.model.ChangeStatus;
import com.story.knowledge.core.model.EntityIdentifier;

import java.util.List;
import java.util.Optional;

/**
 * Append-only record of every attempted cross-store mutation and its outcome.
 *
 * <p>A past event is never mutated. A status change appends a new event with the
 * same transaction id, and the ledger rejects it unless its status is a legal
 * successor of the latest status recorded for that transaction.</p>
 */
public interface ChangeEventLedger {

    /**
     * Appends an event.
     *
     * @throws IllegalStateException if the event's status does not follow the
     *                               transaction's latest status
     */
    void record(ChangeEvent event);

    /**
     * Every event of an entity, in append order.
     */
    List<ChangeEvent> history(EntityIdentifier entityId);

    /**
     * Every event of a transaction, in append order.
     */
    List<ChangeEvent> findByTransaction(String transactionId);

    /**
     * Events recorded with the given status, in append order.
     */
    List<ChangeEvent> findByStatus(ChangeStatus status);

    /**
     * Most recently appended event of a transaction.
     */
    default Optional<ChangeEvent> latest(String transactionId) {
        List<ChangeEvent> events = findByTransaction(transactionId);
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }

    /**
     * {@code RECONCILIATION_REQUIRED} events whose transaction has not moved on since,
     * oldest first.
     */
    default List<ChangeEvent> findUnresolvedReconciliations() {
        return findByStatus(ChangeStatus.RECONCILIATION_REQUIRED).stream()
                .filter(event -> latest(event.transactionId())
                        .map(last -> last.id().equals(event.id()))
                        .orElse(false))
                .toList();
    }

    /**
     * Total number of events.
     */
    int size();

    /**
     * Rejects {@code next} unless it is a legal successor of {@code latest}.
     */
    static void requireLegalSuccessor(Optional<ChangeEvent> latest, ChangeEvent next) {
        latest.ifPresent(last -> {
            if (!last.status().canTransitionTo(next.status())) {
                throw new IllegalStateException("Transaction " + next.transactionId() + " cannot move from "
                        + last.status() + " to " + next.status());
            }
        });
    }
}
