package com.story.knowledge.store;

import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.Relationship;
import com.story.knowledge.core.model.StoryElementNode;

import java.util.Objects;

/**
 * A write staged against the graph store. Every operation is an upsert keyed by
 * identity, so applying it twice leaves the same graph as applying it once.
 */
public interface GraphOperation {

    /**
     * Identifier of the node this operation is anchored on.
     */
    EntityIdentifier anchor();

    /**
     * Upsert node by id, merging declared fields.
     */
    record UpsertNode(StoryElementNode node) implements GraphOperation {
        public UpsertNode {
            Objects.requireNonNull(node, "node is required");
        }

        @Override
        public EntityIdentifier anchor() {
            return node.getId();
        }
    }

    /**
     * Upsert edge by (source, target, type).
     */
    record UpsertRelationship(Relationship relationship) implements GraphOperation {
        public UpsertRelationship {
            Objects.requireNonNull(relationship, "relationship is required");
        }

        @Override
        public EntityIdentifier anchor() {
            return relationship.sourceId();
        }
    }
}
