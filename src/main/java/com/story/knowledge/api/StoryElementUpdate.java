package com.story.knowledge.api;

import java.util.List;

/**
 * One {@code updateStoryElement} call, as submitted in batches to {@link AsyncKnowledgeBase}.
 *
 * @param elementType   element type, e.g. {@code character}
 * @param explicitKey   caller-supplied natural key, or {@code null} to key by content
 * @param content       element content
 * @param relationships outgoing relationships, may be empty
 */
public record StoryElementUpdate(String elementType, String explicitKey, String content,
                                 List<RelationshipRequest> relationships) {

    public StoryElementUpdate {
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
    }

    public static StoryElementUpdate of(String elementType, String content) {
        return new StoryElementUpdate(elementType, null, content, List.of());
    }

    public static StoryElementUpdate of(String elementType, String content, List<RelationshipRequest> relationships) {
        return new StoryElementUpdate(elementType, null, content, relationships);
    }
}
