package com.story.knowledge.api;

import com.story.knowledge.chaos.ChaosGraphStore;
import com.story.knowledge.chaos.ChaosVectorStore;
import com.story.knowledge.core.exception.AbortedException;
import com.story.knowledge.core.exception.ReconciliationRequiredException;
import com.story.knowledge.core.exception.ValidationException;
import com.story.knowledge.core.model.ChangeEvent;
import com.story.knowledge.core.model.ChangeStatus;
import com.story.knowledge.core.model.ContentHash;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.Relationship;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.core.model.StoryElementNode;
import com.story.knowledge.graph.GraphConnection;
import com.story.knowledge.graph.PoolConfig;
import com.story.knowledge.graph.SimpleGraphConnectionPool;
import com.story.knowledge.registry.NaturalKey;
import com.story.knowledge.store.VectorEntry;
import com.story.knowledge.store.memory.InMemoryGraphStore;
import com.story.knowledge.store.memory.InMemoryVectorStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class UnifiedKnowledgeBaseTest {

    private static final String SARAH_TEXT = "Sarah enters the room.";

    private InMemoryGraphStore graphBacking;
    private InMemoryVectorStore vectorBacking;
    private ChaosGraphStore graphStore;
    private ChaosVectorStore vectorStore;
    private UnifiedKnowledgeBase kb;

    @BeforeEach
    void setUp() {
        graphBacking = new InMemoryGraphStore();
        vectorBacking = new InMemoryVectorStore();
        graphStore = new ChaosGraphStore(graphBacking);
        vectorStore = new ChaosVectorStore(vectorBacking);
        kb = UnifiedKnowledgeBase.builder()
                .graphStore(graphStore)
                .vectorStore(vectorStore)
                .options(KnowledgeBaseOptions.builder().backoff(1, 5, 0.0).build())
                .build();
    }

    @AfterEach
    void tearDown() {
        kb.close();
    }

    // ========== Write Tests ==========

    @Test
    @DisplayName("Should write the node and the vector entry under one identifier")
    void testSarahEntersTheRoom() {
        EntityIdentifier id = kb.updateStoryElement("character", SARAH_TEXT, List.of());

        StoryElementNode node = kb.findNode(id).orElseThrow();
        assertEquals("character", node.getElementType());
        assertEquals(ContentHash.of(SARAH_TEXT), node.getContentHash());

        VectorEntry entry = kb.findVectorEntry(id).orElseThrow();
        assertEquals(SARAH_TEXT, entry.content());
        assertEquals("character", entry.metadata().get("type"));

        List<ChangeEvent> history = kb.history(id);
        assertEquals(List.of(ChangeStatus.PENDING, ChangeStatus.COMMITTED),
                history.stream().map(ChangeEvent::status).toList());
    }

    @Test
    @DisplayName("Should return the same identifier for identical content")
    void testIdenticalContentIsIdempotent() {
        EntityIdentifier first = kb.updateStoryElement("character", SARAH_TEXT, List.of());
        EntityIdentifier second = kb.updateStoryElement("character", SARAH_TEXT, List.of());

        assertEquals(first, second);
        assertEquals(1, graphBacking.nodeCount());
        assertEquals(1, vectorBacking.size());
        assertEquals(SARAH_TEXT, kb.findVectorEntry(first).orElseThrow().content());
    }

    @Test
    @DisplayName("Should give different identifiers to different content or types")
    void testDifferentContent() {
        EntityIdentifier sarah = kb.updateStoryElement("character", SARAH_TEXT);
        EntityIdentifier tom = kb.updateStoryElement("character", "Tom waits outside.");
        EntityIdentifier scene = kb.updateStoryElement("scene", SARAH_TEXT);

        assertEquals(3, Set.of(sarah, tom, scene).size());
    }

    @Test
    @DisplayName("Should update the same element when an explicit key is reused")
    void testExplicitKey() {
        EntityIdentifier first = kb.updateStoryElement("character", "sarah", SARAH_TEXT, List.of());
        EntityIdentifier second = kb.updateStoryElement("character", "sarah", "Sarah leaves.", List.of());

        assertEquals(first, second);
        assertEquals("Sarah leaves.", kb.findVectorEntry(first).orElseThrow().content());
        assertEquals(ContentHash.of("Sarah leaves."), kb.findNode(first).orElseThrow().getContentHash());
        assertEquals(first, kb.findIdentifier(NaturalKey.explicit("character", "sarah")).orElseThrow());
    }

    @Test
    @DisplayName("Should create each relationship once however often it is submitted")
    void testIdempotentRelationships() {
        EntityIdentifier tom = kb.updateStoryElement("character", "Tom waits outside.");
        List<RelationshipRequest> knowsTom = List.of(RelationshipRequest.of(tom, "KNOWS"));

        EntityIdentifier sarah = kb.updateStoryElement("character", "sarah", SARAH_TEXT, knowsTom);
        kb.updateStoryElement("character", "sarah", SARAH_TEXT, knowsTom);

        assertEquals(List.of(Relationship.of(sarah, tom, "KNOWS")), kb.findRelationships(sarah));
    }

    @Test
    @DisplayName("Should accept the record form of an update")
    void testUpdateRecord() {
        EntityIdentifier id = kb.update(StoryElementUpdate.of("location", "The tavern is crowded."));

        assertEquals("location", kb.findNode(id).orElseThrow().getElementType());
    }

    // ========== Validation Tests ==========

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should reject blank element types")
        void testBlankType() {
            assertThrows(ValidationException.class, () -> kb.updateStoryElement(" ", SARAH_TEXT));
        }

        @Test
        @DisplayName("Should reject null content")
        void testNullContent() {
            assertThrows(ValidationException.class, () -> kb.updateStoryElement("character", null));
        }

        @Test
        @DisplayName("Should reject blank explicit keys")
        void testBlankExplicitKey() {
            assertThrows(ValidationException.class,
                    () -> kb.updateStoryElement("character", " ", SARAH_TEXT, List.of()));
        }

        @Test
        @DisplayName("Should reject malformed relationship types without writing anything")
        void testBadRelationshipType() {
            EntityIdentifier tom = EntityIdentifier.of("tom");
            List<RelationshipRequest> relationships = List.of(RelationshipRequest.of(tom, "KNOWS WELL"));

            assertThrows(ValidationException.class,
                    () -> kb.updateStoryElement("character", SARAH_TEXT, relationships));
            assertEquals(0, graphBacking.nodeCount());
            assertEquals(0, vectorBacking.size());
            assertEquals(0, graphStore.prepareCalls());
        }

        @Test
        @DisplayName("Should reject null relationship entries")
        void testNullRelationship() {
            List<RelationshipRequest> relationships = new ArrayList<>();
            relationships.add(null);

            assertThrows(ValidationException.class,
                    () -> kb.updateStoryElement("character", SARAH_TEXT, relationships));
        }
    }

    // ========== Failure Tests ==========

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should leave both stores untouched when the vector prepare fails")
        void testVectorPrepareFailure() {
            vectorStore.setFailPrepare(true);

            AbortedException e = assertThrows(AbortedException.class,
                    () -> kb.updateStoryElement("character", SARAH_TEXT));

            assertTrue(e.isSafeToRetry());
            assertEquals(StoreSide.VECTOR, e.getSide());
            assertEquals(0, graphBacking.nodeCount());
            assertEquals(0, graphBacking.stagedCount());
            assertEquals(0, vectorBacking.size());
        }

        @Test
        @DisplayName("Should succeed on retry after an aborted write")
        void testRetryAfterAbort() {
            vectorStore.setFailPrepare(true);
            assertThrows(AbortedException.class, () -> kb.updateStoryElement("character", SARAH_TEXT));

            vectorStore.reset();
            EntityIdentifier id = kb.updateStoryElement("character", SARAH_TEXT);

            assertTrue(kb.findNode(id).isPresent());
            assertTrue(kb.findVectorEntry(id).isPresent());
        }

        @Test
        @DisplayName("Should surface a partial commit with its ledgered payload")
        void testPartialCommit() {
            vectorStore.setFailCommit(true);

            ReconciliationRequiredException e = assertThrows(ReconciliationRequiredException.class,
                    () -> kb.updateStoryElement("character", SARAH_TEXT));

            assertFalse(e.isSafeToRetry());
            assertEquals(StoreSide.GRAPH, e.getCommittedSide().orElseThrow());
            assertEquals(StoreSide.VECTOR, e.getFailedSide());
            assertEquals(SARAH_TEXT, e.getPayload().get("content"));

            EntityIdentifier id = e.getEntityId();
            assertTrue(kb.findNode(id).isPresent());
            assertTrue(kb.findVectorEntry(id).isEmpty());
            assertEquals(1, kb.getLedger().findUnresolvedReconciliations().size());
        }
    }

    // ========== Concurrency Tests ==========

    @Test
    @DisplayName("Should resolve concurrent writes of the same content to one identifier")
    void testConcurrentSameKey() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<EntityIdentifier>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return kb.updateStoryElement("character", SARAH_TEXT);
                }));
            }
            start.countDown();

            Set<EntityIdentifier> ids = new HashSet<>();
            for (Future<EntityIdentifier> future : futures) {
                ids.add(future.get(10, TimeUnit.SECONDS));
            }

            assertEquals(1, ids.size());
            assertEquals(1, graphBacking.nodeCount());
            assertEquals(1, vectorBacking.size());
            EntityIdentifier id = ids.iterator().next();
            assertEquals(threads, kb.history(id).stream()
                    .filter(event -> event.status() == ChangeStatus.COMMITTED).count());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should expose its components")
    void testComponents() {
        assertNotNull(kb.getCoordinator());
        assertNotNull(kb.getRegistry());
        assertNotNull(kb.reconciliation());
        assertEquals(1, kb.getCoordinator().getConfig().retryPolicy().backoff().calculate(1));
    }

    @Nested
    @DisplayName("FalkorDB wiring")
    class FalkorDBWiring {

        private GraphConnection connection;

        @BeforeEach
        void setUp() {
            connection = mock(GraphConnection.class);
            when(connection.isConnected()).thenReturn(true);
            when(connection.getGraphName()).thenReturn("story-test");
        }

        private UnifiedKnowledgeBase.Builder pooled() {
            return UnifiedKnowledgeBase.builder()
                    .connectionPool(new SimpleGraphConnectionPool(PoolConfig.local("story-test"), () -> connection));
        }

        @Test
        @DisplayName("Should create indexes when built on a connection pool")
        void testIndexesCreated() {
            try (UnifiedKnowledgeBase pooledKb = pooled().build()) {
                verify(connection, times(1)).ensureIndexes();
            }
        }

        @Test
        @DisplayName("Should skip index creation when disabled")
        void testIndexesSkipped() {
            try (UnifiedKnowledgeBase pooledKb = pooled().createIndexes(false).build()) {
                verify(connection, never()).ensureIndexes();
            }
        }
    }
}
