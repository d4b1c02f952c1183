package com.story.knowledge.core.model;

import com.story.knowledge.core.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Directed, typed edge between two story elements.
 *
 * <p>Identity is the (source, target, type) triple: the graph store keeps at most
 * one edge per triple, however many times it is written.</p>
 */
public record Relationship(EntityIdentifier sourceId, EntityIdentifier targetId, String type) {

    public Relationship {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(targetId, "targetId is required");
        if (type == null || type.isBlank()) {
            throw new ValidationException("Relationship type must not be null or blank");
        }
    }

    public static Relationship of(EntityIdentifier sourceId, EntityIdentifier targetId, String type) {
        return new Relationship(sourceId, targetId, type);
    }

    /**
     * Flat representation stored in ledger payloads.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", sourceId.value());
        payload.put("target", targetId.value());
        payload.put("type", type);
        return payload;
    }

    public static Relationship fromPayload(Map<?, ?> payload) {
        return new Relationship(
                EntityIdentifier.of((String) payload.get("source")),
                EntityIdentifier.of((String) payload.get("target")),
                (String) payload.get("type"));
    }

    @Override
    public String toString() {
        return "(" + sourceId + ")-[:" + type + "]->(" + targetId + ")";
    }
}
