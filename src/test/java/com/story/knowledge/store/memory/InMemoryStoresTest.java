package com.story.knowledge.store.memory;

import com.story.knowledge.core.exception.StoreException;
import com.story.knowledge.core.exception.ValidationException;
import com.story.knowledge.core.model.ContentHash;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.Relationship;
import com.story.knowledge.core.model.StoryElementNode;
import com.story.knowledge.store.Deadline;
import com.story.knowledge.store.GraphOperation;
import com.story.knowledge.store.StagingToken;
import com.story.knowledge.store.VectorEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStoresTest {

    private static final EntityIdentifier SARAH = EntityIdentifier.of("sarah");
    private static final EntityIdentifier TOM = EntityIdentifier.of("tom");

    @Nested
    @DisplayName("InMemoryGraphStore")
    class GraphStoreTests {

        private final InMemoryGraphStore store = new InMemoryGraphStore();

        private List<GraphOperation> sarahKnowsTom() {
            return List.of(
                    new GraphOperation.UpsertNode(new StoryElementNode(SARAH, "character", ContentHash.of("Sarah"))),
                    new GraphOperation.UpsertRelationship(Relationship.of(SARAH, TOM, "KNOWS")));
        }

        @Test
        @DisplayName("Should keep staged operations invisible until commit")
        void stagingIsInvisible() {
            StagingToken token = store.prepareWrite(sarahKnowsTom(), Deadline.none());
            assertTrue(store.findNode(SARAH).isEmpty());
            assertEquals(1, store.stagedCount());

            store.commit(token, Deadline.none());
            assertTrue(store.findNode(SARAH).isPresent());
            assertEquals(0, store.stagedCount());
        }

        @Test
        @DisplayName("Should create a stub node for a relationship target")
        void stubTarget() {
            store.commit(store.prepareWrite(sarahKnowsTom(), Deadline.none()), Deadline.none());
            StoryElementNode tom = store.findNode(TOM).orElseThrow();
            assertNull(tom.getElementType());
            assertEquals(2, store.nodeCount());
        }

        @Test
        @DisplayName("Should keep one edge per (source, target, type)")
        void idempotentEdges() {
            store.commit(store.prepareWrite(sarahKnowsTom(), Deadline.none()), Deadline.none());
            store.commit(store.prepareWrite(sarahKnowsTom(), Deadline.none()), Deadline.none());
            assertEquals(1, store.findRelationships(SARAH).size());
            assertEquals(2, store.nodeCount());
        }

        @Test
        @DisplayName("Should drop discarded work and ignore unknown tokens")
        void discard() {
            StagingToken token = store.prepareWrite(sarahKnowsTom(), Deadline.none());
            store.discard(token);
            store.discard(token);
            assertEquals(0, store.stagedCount());
            assertThrows(StoreException.class, () -> store.commit(token, Deadline.none()));
            assertTrue(store.findNode(SARAH).isEmpty());
        }

        @Test
        @DisplayName("Should reject an empty batch")
        void emptyBatch() {
            assertThrows(ValidationException.class, () -> store.prepareWrite(List.of(), Deadline.none()));
        }

        @Test
        @DisplayName("Should refuse work once closed")
        void closed() {
            store.close();
            assertThrows(StoreException.class, () -> store.prepareWrite(sarahKnowsTom(), Deadline.none()));
        }
    }

    @Nested
    @DisplayName("InMemoryVectorStore")
    class VectorStoreTests {

        private final InMemoryVectorStore store = new InMemoryVectorStore();

        @Test
        @DisplayName("Should keep staged entries invisible until commit")
        void stagingIsInvisible() {
            StagingToken token = store.prepareUpsert(new VectorEntry(SARAH, "Sarah", Map.of()), Deadline.none());
            assertTrue(store.find(SARAH).isEmpty());
            store.commit(token, Deadline.none());
            assertEquals("Sarah", store.find(SARAH).orElseThrow().content());
        }

        @Test
        @DisplayName("Should upsert by id")
        void upsertById() {
            store.commit(store.prepareUpsert(new VectorEntry(SARAH, "v1", Map.of()), Deadline.none()), Deadline.none());
            store.commit(store.prepareUpsert(new VectorEntry(SARAH, "v2", Map.of()), Deadline.none()), Deadline.none());
            assertEquals(1, store.size());
            assertEquals("v2", store.find(SARAH).orElseThrow().content());
        }

        @Test
        @DisplayName("Should reject blank content")
        void blankContent() {
            assertThrows(ValidationException.class,
                    () -> store.prepareUpsert(new VectorEntry(SARAH, "", Map.of()), Deadline.none()));
        }

        @Test
        @DisplayName("Should drop discarded entries")
        void discard() {
            StagingToken token = store.prepareUpsert(new VectorEntry(SARAH, "Sarah", Map.of()), Deadline.none());
            store.discard(token);
            assertEquals(0, store.stagedCount());
            assertThrows(StoreException.class, () -> store.commit(token, Deadline.none()));
        }
    }
}
