package com.story.knowledge.registry;

import com.story.knowledge.core.exception.ValidationException;
import com.story.knowledge.core.model.ContentHash;

/**
 * Caller-meaningful key that the registry maps to a canonical identifier.
 *
 * @param value the encoded key, never blank
 */
public record NaturalKey(String value) {

    public NaturalKey {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Natural key must not be null or blank");
        }
    }

    /**
     * Key derived from the element type and the hash of its content.
     */
    public static NaturalKey ofContent(String elementType, ContentHash contentHash) {
        if (elementType == null || elementType.isBlank()) {
            throw new ValidationException("Element type must not be null or blank");
        }
        return new NaturalKey("content:" + elementType + ":" + contentHash.value());
    }

    /**
     * Key supplied by the caller, e.g. a character name that stays stable while
     * the content describing it changes.
     */
    public static NaturalKey explicit(String elementType, String key) {
        if (elementType == null || elementType.isBlank()) {
            throw new ValidationException("Element type must not be null or blank");
        }
        if (key == null || key.isBlank()) {
            throw new ValidationException("Explicit key must not be null or blank");
        }
        return new NaturalKey("explicit:" + elementType + ":" + key);
    }

    @Override
    public String toString() {
        return value;
    }
}
