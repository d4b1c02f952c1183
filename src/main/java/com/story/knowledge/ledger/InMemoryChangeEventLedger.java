package com.story.knowledge.ledger;

import com.story.knowledge.core.model.ChangeEvent;
import com.story.knowledge.core.model.ChangeStatus;
import com.story.knowledge.core.model.EntityIdentifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ChangeEventLedger}.
 * Reads are lock-free over a {@link CopyOnWriteArrayList}; appends are serialized
 * so the successor check and the append happen together.
 */
public class InMemoryChangeEventLedger implements ChangeEventLedger {

    private final List<ChangeEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public synchronized void record(ChangeEvent event) {
        ChangeEventLedger.requireLegalSuccessor(latest(event.transactionId()), event);
        events.add(event);
    }

    @Override
    public List<ChangeEvent> history(EntityIdentifier entityId) {
        return events.stream()
                .filter(e -> e.entityId().equals(entityId))
                .toList();
    }

    @Override
    public List<ChangeEvent> findByTransaction(String transactionId) {
        return events.stream()
                .filter(e -> e.transactionId().equals(transactionId))
                .toList();
    }

    @Override
    public List<ChangeEvent> findByStatus(ChangeStatus status) {
        return events.stream()
                .filter(e -> e.status() == status)
                .toList();
    }

    @Override
    public int size() {
        return events.size();
    }

    public List<ChangeEvent> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }
}
