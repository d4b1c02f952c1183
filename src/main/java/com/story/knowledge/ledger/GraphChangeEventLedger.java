package com.story.knowledge.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.story.knowledge.core.exception.StoreException;
import com.story.knowledge.core.model.ChangeEvent;
import com.story.knowledge.core.model.ChangeStatus;
import com.story.knowledge.core.model.ChangeType;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-backed implementation of {@link ChangeEventLedger}.
 * Persists each event as a {@code :ChangeEvent} node; payloads are stored as JSON.
 * A monotonically increasing {@code seq} property keeps append order.
 */
public class GraphChangeEventLedger implements ChangeEventLedger {
    private static final Logger log = LoggerFactory.getLogger(GraphChangeEventLedger.class);

    private static final String RETURN_COLUMNS = """
            RETURN c.id AS id, c.transactionId AS transactionId, c.entityId AS entityId,
                   c.timestamp AS timestamp, c.changeType AS changeType, c.payload AS payload,
                   c.status AS status
            ORDER BY c.seq ASC
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphChangeEventLedger(GraphConnection connection) {
        this(connection, new ObjectMapper());
    }

    public GraphChangeEventLedger(GraphConnection connection, ObjectMapper objectMapper) {
        this.connection = connection;
        this.objectMapper = objectMapper;
        createIndexes();
    }

    private void createIndexes() {
        safeExecute("CREATE INDEX FOR (c:ChangeEvent) ON (c.entityId)");
        safeExecute("CREATE INDEX FOR (c:ChangeEvent) ON (c.transactionId)");
        safeExecute("CREATE INDEX FOR (c:ChangeEvent) ON (c.status)");
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (Exception e) {
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public synchronized void record(ChangeEvent event) {
        ChangeEventLedger.requireLegalSuccessor(latest(event.transactionId()), event);
        String query = """
                OPTIONAL MATCH (last:ChangeEvent)
                WITH coalesce(max(last.seq), -1) + 1 AS next
                CREATE (c:ChangeEvent {
                    id: $id,
                    transactionId: $transactionId,
                    entityId: $entityId,
                    timestamp: $timestamp,
                    changeType: $changeType,
                    payload: $payload,
                    status: $status,
                    seq: next
                })
                """;
        connection.execute(query, Map.of(
                "id", event.id(),
                "transactionId", event.transactionId(),
                "entityId", event.entityId().value(),
                "timestamp", event.timestamp().toString(),
                "changeType", event.changeType().name(),
                "payload", serializePayload(event.payload()),
                "status", event.status().name()
        ));
        log.debug("Recorded change event {} {} for entity {}", event.status(), event.transactionId(),
                event.entityId());
    }

    @Override
    public List<ChangeEvent> history(EntityIdentifier entityId) {
        return mapResults(connection.query("MATCH (c:ChangeEvent {entityId: $entityId})\n" + RETURN_COLUMNS,
                Map.of("entityId", entityId.value())));
    }

    @Override
    public List<ChangeEvent> findByTransaction(String transactionId) {
        return mapResults(connection.query("MATCH (c:ChangeEvent {transactionId: $transactionId})\n" + RETURN_COLUMNS,
                Map.of("transactionId", transactionId)));
    }

    @Override
    public List<ChangeEvent> findByStatus(ChangeStatus status) {
        return mapResults(connection.query("MATCH (c:ChangeEvent {status: $status})\n" + RETURN_COLUMNS,
                Map.of("status", status.name())));
    }

    @Override
    public int size() {
        List<Map<String, Object>> results = connection.query("""
                MATCH (c:ChangeEvent)
                RETURN count(c) AS cnt
                """);
        if (results.isEmpty()) {
            return 0;
        }
        return ((Number) results.get(0).get("cnt")).intValue();
    }

    private List<ChangeEvent> mapResults(List<Map<String, Object>> rows) {
        return rows.stream().map(this::mapToChangeEvent).toList();
    }

    private ChangeEvent mapToChangeEvent(Map<String, Object> row) {
        return ChangeEvent.builder()
                .id((String) row.get("id"))
                .transactionId((String) row.get("transactionId"))
                .entityId(EntityIdentifier.of((String) row.get("entityId")))
                .timestamp(Instant.parse((String) row.get("timestamp")))
                .changeType(ChangeType.valueOf((String) row.get("changeType")))
                .payload(deserializePayload((String) row.get("payload")))
                .status(ChangeStatus.valueOf((String) row.get("status")))
                .build();
    }

    private String serializePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            // a ledger entry without its payload could not drive reconciliation
            throw new StoreException("Failed to serialize change event payload: " + e.getMessage(), null, e);
        }
    }

    private Map<String, Object> deserializePayload(String json) {
        if (json == null || json.isEmpty() || "{}".equals(json)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt change event payload: " + e.getMessage(), null, e);
        }
    }
}
