package com.story.knowledge.graph;

import com.story.knowledge.core.exception.ValidationException;
import com.story.knowledge.core.model.Relationship;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.core.model.StoryElementNode;
import com.story.knowledge.store.GraphOperation;
import com.story.knowledge.store.VectorEntry;

/**
 * Input validation for store writes.
 * Relationship types and element types end up as Cypher identifiers or values,
 * so they are restricted to a safe character set.
 */
public final class InputSanitizer {

    /** Maximum allowed length for element types. */
    public static final int MAX_ELEMENT_TYPE_LENGTH = 100;

    /** Maximum allowed length for Cypher string values. */
    public static final int MAX_CYPHER_VALUE_LENGTH = 4000;

    /** Maximum allowed length for embedded content. */
    public static final int MAX_CONTENT_LENGTH = 32_000;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates one staged graph operation.
     *
     * @throws ValidationException if any part of the operation is malformed
     */
    public static void validate(GraphOperation operation) {
        if (operation instanceof GraphOperation.UpsertNode upsert) {
            validateNode(upsert.node());
        } else if (operation instanceof GraphOperation.UpsertRelationship upsert) {
            validateRelationship(upsert.relationship());
        } else {
            throw new ValidationException("Unsupported graph operation: " + operation, StoreSide.GRAPH);
        }
    }

    public static void validateNode(StoryElementNode node) {
        sanitizeForCypher(node.getId().value(), StoreSide.GRAPH);
        if (node.getElementType() != null) {
            validateElementType(node.getElementType());
        }
    }

    public static void validateRelationship(Relationship relationship) {
        sanitizeForCypher(relationship.sourceId().value(), StoreSide.GRAPH);
        sanitizeForCypher(relationship.targetId().value(), StoreSide.GRAPH);
        validateRelationshipType(relationship.type());
    }

    /**
     * Validates a vector entry before it is embedded.
     */
    public static void validate(VectorEntry entry) {
        if (entry.content().isBlank()) {
            throw new ValidationException("Content of " + entry.id() + " must not be blank", StoreSide.VECTOR);
        }
        if (entry.content().length() > MAX_CONTENT_LENGTH) {
            throw new ValidationException("Content exceeds maximum length of " + MAX_CONTENT_LENGTH +
                    " characters (was " + entry.content().length() + ")", StoreSide.VECTOR);
        }
    }

    /**
     * Validates an element type such as {@code character} or {@code scene}.
     * Rejects blank, overly long, or control-character-containing values.
     */
    public static void validateElementType(String elementType) {
        if (elementType == null || elementType.isBlank()) {
            throw new ValidationException("Element type must not be null or blank");
        }
        if (elementType.length() > MAX_ELEMENT_TYPE_LENGTH) {
            throw new ValidationException(
                    "Element type exceeds maximum length of " + MAX_ELEMENT_TYPE_LENGTH +
                            " characters (was " + elementType.length() + ")");
        }
        if (containsControlCharacters(elementType)) {
            throw new ValidationException("Element type must not contain control characters");
        }
    }

    /**
     * Validates a relationship type string.
     * Only alphanumeric characters and underscores are allowed.
     */
    public static void validateRelationshipType(String relationshipType) {
        if (relationshipType == null || relationshipType.isBlank()) {
            throw new ValidationException("Relationship type must not be null or blank", StoreSide.GRAPH);
        }
        if (!relationshipType.matches("^[A-Za-z0-9_]+$")) {
            throw new ValidationException(
                    "Relationship type must contain only alphanumeric characters and underscores, " +
                            "got: '" + relationshipType + "'", StoreSide.GRAPH);
        }
    }

    /**
     * Validates a string value for safe use in Cypher queries.
     */
    public static void sanitizeForCypher(String value, StoreSide side) {
        if (value != null && value.length() > MAX_CYPHER_VALUE_LENGTH) {
            throw new ValidationException(
                    "Value exceeds maximum Cypher string length of " + MAX_CYPHER_VALUE_LENGTH +
                            " characters (was " + value.length() + ")", side);
        }
        if (value != null && containsControlCharacters(value)) {
            throw new ValidationException("Value must not contain control characters", side);
        }
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding common whitespace characters (tab, newline, carriage return).
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
