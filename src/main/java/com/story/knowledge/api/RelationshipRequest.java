package com.story.knowledge.api;

import com.story.knowledge.core.exception.ValidationException;
import com.story.knowledge.core.model.EntityIdentifier;

/**
 * Outgoing relationship requested for the element being updated.
 *
 * @param target identifier of the related element
 * @param type   relationship type, e.g. {@code KNOWS}
 */
public record RelationshipRequest(EntityIdentifier target, String type) {

    public RelationshipRequest {
        if (target == null) {
            throw new ValidationException("Relationship target is required");
        }
        if (type == null || type.isBlank()) {
            throw new ValidationException("Relationship type must not be null or blank");
        }
    }

    public static RelationshipRequest of(EntityIdentifier target, String type) {
        return new RelationshipRequest(target, type);
    }
}
