package com.story.knowledge.core.model;

/**
 * The two backing stores a transaction spans.
 * Declaration order is the commit order.
 */
public enum StoreSide {
    GRAPH,
    VECTOR
}
