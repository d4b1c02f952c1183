package com.story.knowledge.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable ledger record of one attempted cross-store mutation at one point of
 * its lifecycle. A status change never edits an event: {@link #advance} builds a
 * successor carrying the same transaction id, which is appended to the ledger.
 */
public record ChangeEvent(
        String id,
        String transactionId,
        EntityIdentifier entityId,
        Instant timestamp,
        ChangeType changeType,
        Map<String, Object> payload,
        ChangeStatus status
) {
    public ChangeEvent {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(transactionId, "transactionId is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(changeType, "changeType is required");
        Objects.requireNonNull(status, "status is required");
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    /**
     * Builds the successor of this event in {@code next} status.
     *
     * @param next         the new status
     * @param extraPayload entries added to (or replacing) the payload
     * @throws IllegalStateException if the transition is not monotonic
     */
    public ChangeEvent advance(ChangeStatus next, Map<String, Object> extraPayload) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal change event transition " + status + " -> " + next + " for transaction " + transactionId);
        }
        Map<String, Object> merged = new LinkedHashMap<>(payload);
        if (extraPayload != null) {
            merged.putAll(extraPayload);
        }
        return new ChangeEvent(UUID.randomUUID().toString(), transactionId, entityId,
                Instant.now(), changeType, merged, next);
    }

    public ChangeEvent advance(ChangeStatus next) {
        return advance(next, Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String transactionId;
        private EntityIdentifier entityId;
        private Instant timestamp = Instant.now();
        private ChangeType changeType;
        private Map<String, Object> payload;
        private ChangeStatus status = ChangeStatus.PENDING;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder transactionId(String transactionId) {
            this.transactionId = transactionId;
            return this;
        }

        public Builder entityId(EntityIdentifier entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder changeType(ChangeType changeType) {
            this.changeType = changeType;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder status(ChangeStatus status) {
            this.status = status;
            return this;
        }

        public ChangeEvent build() {
            return new ChangeEvent(id, transactionId, entityId, timestamp, changeType, payload, status);
        }
    }
}
