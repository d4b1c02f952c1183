package com.story.knowledge.registry;

import com.story.knowledge.core.model.EntityIdentifier;

import java.util.Optional;

/**
 * Append-only correlation table from natural keys to canonical identifiers.
 *
 * <p>The same key always maps to the same identifier. Concurrent calls for an
 * unseen key never produce two identifiers: the first writer wins and the others
 * observe its identifier. There is no removal.</p>
 */
public interface EntityIdentifierRegistry {

    /**
     * Returns the identifier mapped to {@code key}, allocating one on first use.
     */
    EntityIdentifier resolveOrCreate(NaturalKey key);

    /**
     * Returns the identifier mapped to {@code key}, without allocating.
     */
    Optional<EntityIdentifier> find(NaturalKey key);

    /**
     * Number of mapped keys.
     */
    long size();
}
