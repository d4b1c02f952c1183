package com.story.knowledge.core.model;

import com.story.knowledge.core.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StoryModelTest {

    @Nested
    @DisplayName("ContentHash")
    class ContentHashTests {

        @Test
        @DisplayName("Should produce the SHA-256 hex digest")
        void knownDigest() {
            assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                    ContentHash.of("abc").value());
        }

        @Test
        @DisplayName("Should be stable for identical content")
        void stable() {
            assertEquals(ContentHash.of("Sarah enters the room."), ContentHash.of("Sarah enters the room."));
            assertNotEquals(ContentHash.of("Sarah enters the room."), ContentHash.of("Sarah leaves the room."));
        }

        @Test
        @DisplayName("Should reject null content and malformed digests")
        void validation() {
            assertThrows(ValidationException.class, () -> ContentHash.of(null));
            assertThrows(ValidationException.class, () -> new ContentHash("not-a-hash"));
            assertThrows(ValidationException.class, () -> new ContentHash(ContentHash.of("abc").value().toUpperCase()));
        }
    }

    @Nested
    @DisplayName("EntityIdentifier")
    class EntityIdentifierTests {

        @Test
        @DisplayName("Should reject blank values")
        void rejectsBlank() {
            assertThrows(ValidationException.class, () -> EntityIdentifier.of(" "));
            assertThrows(ValidationException.class, () -> EntityIdentifier.of(null));
        }

        @Test
        @DisplayName("Should generate distinct identifiers")
        void generatesDistinct() {
            assertNotEquals(EntityIdentifier.generate(), EntityIdentifier.generate());
        }
    }

    @Nested
    @DisplayName("StoryElementNode")
    class StoryElementNodeTests {

        private final EntityIdentifier id = EntityIdentifier.of("sarah");

        @Test
        @DisplayName("Should keep fields the update leaves null")
        void mergeKeepsMissingFields() {
            StoryElementNode stored = new StoryElementNode(id, "character", ContentHash.of("v1"));
            StoryElementNode merged = stored.merge(new StoryElementNode(id, null, ContentHash.of("v2")));

            assertEquals("character", merged.getElementType());
            assertEquals(ContentHash.of("v2"), merged.getContentHash());
        }

        @Test
        @DisplayName("Should refuse to merge another node")
        void mergeOtherNode() {
            StoryElementNode stored = new StoryElementNode(id, "character", null);
            assertThrows(IllegalArgumentException.class,
                    () -> stored.merge(new StoryElementNode(EntityIdentifier.of("tom"), null, null)));
        }
    }

    @Nested
    @DisplayName("Relationship")
    class RelationshipTests {

        @Test
        @DisplayName("Should be identified by source, target and type")
        void identity() {
            EntityIdentifier sarah = EntityIdentifier.of("sarah");
            EntityIdentifier tom = EntityIdentifier.of("tom");
            assertEquals(Relationship.of(sarah, tom, "KNOWS"), Relationship.of(sarah, tom, "KNOWS"));
            assertNotEquals(Relationship.of(sarah, tom, "KNOWS"), Relationship.of(tom, sarah, "KNOWS"));
        }

        @Test
        @DisplayName("Should survive the ledger payload form")
        void payloadForm() {
            Relationship relationship = Relationship.of(EntityIdentifier.of("sarah"), EntityIdentifier.of("tom"), "KNOWS");
            Map<String, Object> payload = relationship.toPayload();
            assertEquals(Map.of("source", "sarah", "target", "tom", "type", "KNOWS"), payload);
            assertEquals(relationship, Relationship.fromPayload(payload));
        }

        @Test
        @DisplayName("Should reject a blank type")
        void blankType() {
            assertThrows(ValidationException.class,
                    () -> Relationship.of(EntityIdentifier.of("a"), EntityIdentifier.of("b"), ""));
        }
    }
}
