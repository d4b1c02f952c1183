package com.story.knowledge.core.model;

/**
 * Kind of mutation a {@link ChangeEvent} records.
 */
public enum ChangeType {
    CONTENT,
    RELATIONSHIP,
    METADATA
}
