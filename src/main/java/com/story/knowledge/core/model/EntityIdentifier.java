package com.story.knowledge.core.model;

import com.story.knowledge.core.exception.ValidationException;

import java.util.UUID;

/**
 * Canonical key correlating one logical story element across the graph store
 * and the vector store. Once assigned to an element it is never reassigned.
 *
 * @param value the opaque identifier value, never blank
 */
public record EntityIdentifier(String value) implements Comparable<EntityIdentifier> {

    public EntityIdentifier {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Entity identifier must not be null or blank");
        }
    }

    public static EntityIdentifier of(String value) {
        return new EntityIdentifier(value);
    }

    /**
     * Allocates a fresh identifier. UUIDs are accepted as point ids by the vector store.
     */
    public static EntityIdentifier generate() {
        return new EntityIdentifier(UUID.randomUUID().toString());
    }

    @Override
    public int compareTo(EntityIdentifier other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
