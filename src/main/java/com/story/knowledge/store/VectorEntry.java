package com.story.knowledge.store;

import com.story.knowledge.core.model.EntityIdentifier;

import java.util.Map;
import java.util.Objects;

/**
 * Content indexed in the vector store under the entity's canonical identifier.
 *
 * @param id       canonical identifier, used as the point id
 * @param content  text that is embedded
 * @param metadata flat payload stored next to the vector (e.g. {@code type})
 */
public record VectorEntry(EntityIdentifier id, String content, Map<String, String> metadata) {

    public VectorEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(content, "content is required");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
