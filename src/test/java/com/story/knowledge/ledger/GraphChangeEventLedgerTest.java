package com.story.knowledge.ledger;

import com.story.knowledge.core.model.ChangeEvent;
import com.story.knowledge.core.model.ChangeStatus;
import com.story.knowledge.core.model.ChangeType;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.graph.GraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class GraphChangeEventLedgerTest {

    private static final EntityIdentifier SARAH = EntityIdentifier.of("sarah");

    private GraphConnection connection;
    private GraphChangeEventLedger ledger;

    @BeforeEach
    void setUp() {
        connection = mock(GraphConnection.class);
        ledger = new GraphChangeEventLedger(connection);
    }

    private static Map<String, Object> row(String id, String transactionId, String status, String payload) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("transactionId", transactionId);
        row.put("entityId", "sarah");
        row.put("timestamp", "2024-05-01T10:15:30Z");
        row.put("changeType", "CONTENT");
        row.put("payload", payload);
        row.put("status", status);
        return row;
    }

    @Test
    @DisplayName("Should create a ChangeEvent node with a JSON payload and sequence number")
    @SuppressWarnings("unchecked")
    void testRecord() {
        ChangeEvent event = ChangeEvent.builder()
                .transactionId("tx-1")
                .entityId(SARAH)
                .changeType(ChangeType.CONTENT)
                .payload(Map.of("content", "Sarah enters the room."))
                .build();

        ledger.record(event);

        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(connection).execute(query.capture(), params.capture());
        assertTrue(query.getValue().contains("CREATE (c:ChangeEvent"));
        assertTrue(query.getValue().contains("seq: next"));
        assertEquals("tx-1", params.getValue().get("transactionId"));
        assertEquals("PENDING", params.getValue().get("status"));
        assertEquals("{\"content\":\"Sarah enters the room.\"}", params.getValue().get("payload"));
    }

    @Test
    @DisplayName("Should reject an illegal successor before writing")
    void testRejectsIllegalSuccessor() {
        when(connection.query(contains("transactionId: $transactionId"), anyMap()))
                .thenReturn(List.of(row("e-1", "tx-1", "COMMITTED", "{}")));
        ChangeEvent late = ChangeEvent.builder()
                .transactionId("tx-1")
                .entityId(SARAH)
                .changeType(ChangeType.CONTENT)
                .status(ChangeStatus.FAILED)
                .build();

        assertThrows(IllegalStateException.class, () -> ledger.record(late));
        verify(connection, never()).execute(contains("CREATE (c:ChangeEvent"), anyMap());
    }

    @Test
    @DisplayName("Should map rows back to events with their payload")
    void testHistory() {
        when(connection.query(contains("entityId: $entityId"), anyMap())).thenReturn(List.of(
                row("e-1", "tx-1", "PENDING", "{\"content\":\"Sarah\",\"relationships\":[{\"source\":\"sarah\",\"target\":\"tom\",\"type\":\"KNOWS\"}]}"),
                row("e-2", "tx-1", "RECONCILIATION_REQUIRED", "{\"failedSide\":\"VECTOR\"}")));

        List<ChangeEvent> history = ledger.history(SARAH);

        assertEquals(2, history.size());
        ChangeEvent first = history.get(0);
        assertEquals("e-1", first.id());
        assertEquals(SARAH, first.entityId());
        assertEquals(Instant.parse("2024-05-01T10:15:30Z"), first.timestamp());
        assertEquals(ChangeType.CONTENT, first.changeType());
        assertEquals("Sarah", first.payload().get("content"));
        assertEquals(List.of(Map.of("source", "sarah", "target", "tom", "type", "KNOWS")),
                first.payload().get("relationships"));
        assertEquals(ChangeStatus.RECONCILIATION_REQUIRED, history.get(1).status());
    }

    @Test
    @DisplayName("Should count events")
    void testSize() {
        when(connection.query(contains("count(c)"))).thenReturn(List.of(Map.of("cnt", 7L)));
        assertEquals(7, ledger.size());
    }
}
