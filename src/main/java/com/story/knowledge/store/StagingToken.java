package com.story.knowledge.store;

import com.story.knowledge.core.model.StoreSide;

import java.util.Objects;
import java.util.UUID;

/**
 * Handle on work a store adapter has staged but not yet made visible.
 * Owned by exactly one transaction until it is committed or discarded.
 *
 * @param id   adapter-unique token id
 * @param side store that issued the token
 */
public record StagingToken(String id, StoreSide side) {

    public StagingToken {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(side, "side is required");
    }

    public static StagingToken newToken(StoreSide side) {
        return new StagingToken(UUID.randomUUID().toString(), side);
    }
}
