package com.story.knowledge.graph;

import com.story.knowledge.core.exception.ValidationException;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.store.VectorEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InputSanitizerTest {

    @ParameterizedTest
    @ValueSource(strings = {"KNOWS", "APPEARS_IN", "rel_2"})
    @DisplayName("Should accept identifier-like relationship types")
    void testValidRelationshipTypes(String type) {
        assertDoesNotThrow(() -> InputSanitizer.validateRelationshipType(type));
    }

    @ParameterizedTest
    @ValueSource(strings = {"KNOWS]->(x) DELETE x", "has space", "a-b", "`KNOWS`", ""})
    @DisplayName("Should reject relationship types that could break out of the statement")
    void testInvalidRelationshipTypes(String type) {
        ValidationException e = assertThrows(ValidationException.class,
                () -> InputSanitizer.validateRelationshipType(type));
        assertEquals(StoreSide.GRAPH, e.getSide());
    }

    @Test
    @DisplayName("Should reject control characters and oversized element types")
    void testElementType() {
        assertDoesNotThrow(() -> InputSanitizer.validateElementType("character"));
        assertThrows(ValidationException.class, () -> InputSanitizer.validateElementType("char\0acter"));
        assertThrows(ValidationException.class, () -> InputSanitizer.validateElementType("x".repeat(101)));
        assertThrows(ValidationException.class, () -> InputSanitizer.validateElementType(" "));
    }

    @Test
    @DisplayName("Should cap content length")
    void testContentLength() {
        EntityIdentifier id = EntityIdentifier.of("sarah");
        assertDoesNotThrow(() -> InputSanitizer.validate(new VectorEntry(id, "x".repeat(32_000), Map.of())));
        ValidationException e = assertThrows(ValidationException.class,
                () -> InputSanitizer.validate(new VectorEntry(id, "x".repeat(32_001), Map.of())));
        assertEquals(StoreSide.VECTOR, e.getSide());
    }

    @Test
    @DisplayName("Should allow ordinary whitespace in values")
    void testWhitespace() {
        assertDoesNotThrow(() -> InputSanitizer.sanitizeForCypher("line one\nline two\ttabbed", StoreSide.GRAPH));
    }
}
