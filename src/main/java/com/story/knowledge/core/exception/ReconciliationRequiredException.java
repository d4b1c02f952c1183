package com.story.knowledge.core.exception;

import com.story.knowledge.core.model.ChangeEvent;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.core.model.TransactionPhase;

import java.util.Map;
import java.util.Optional;

/**
 * The stores may disagree about the entity: either one side committed and the
 * other did not, or staged work could not be discarded. The ledger holds a
 * {@code RECONCILIATION_REQUIRED} event with the idempotent payload needed to
 * complete the failed side. The caller must not blindly repeat the full write.
 *
 * <p>If the event itself could not be written, {@link #isLedgered()} is
 * {@code false} and the ledger failure is attached as a suppressed exception.
 * The reconciliation sweep will not see such an outcome; the payload carried
 * here is then the only record of it.</p>
 */
public class ReconciliationRequiredException extends KnowledgeBaseException {

    private final StoreSide committedSide;
    private final ChangeEvent event;
    private final boolean ledgered;

    public ReconciliationRequiredException(String message, EntityIdentifier entityId, TransactionPhase phase,
                                           StoreSide committedSide, StoreSide failedSide,
                                           ChangeEvent event, Throwable cause, RuntimeException ledgerFailure) {
        super(message, entityId, phase, failedSide, cause);
        this.committedSide = committedSide;
        this.event = event;
        this.ledgered = ledgerFailure == null;
        if (ledgerFailure != null) {
            addSuppressed(ledgerFailure);
        }
    }

    /**
     * The store whose commit succeeded, empty when nothing is known to have committed.
     */
    public Optional<StoreSide> getCommittedSide() {
        return Optional.ofNullable(committedSide);
    }

    /**
     * The store that failed.
     */
    public StoreSide getFailedSide() {
        return getSide();
    }

    /**
     * Whether {@link #getEvent()} reached the ledger.
     */
    public boolean isLedgered() {
        return ledgered;
    }

    public ChangeEvent getEvent() {
        return event;
    }

    public Map<String, Object> getPayload() {
        return event.payload();
    }
}
