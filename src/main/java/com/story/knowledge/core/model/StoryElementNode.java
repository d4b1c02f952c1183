package com.story.knowledge.core.model;

import java.util.Objects;

/**
 * Typed graph node for a story element.
 *
 * <p>Fields are declared, not free-form. An update carrying {@code null} for a
 * field leaves that field untouched; any non-null field overwrites the stored
 * value (last write wins per field). History lives in the ledger, not here.</p>
 */
public final class StoryElementNode {

    private final EntityIdentifier id;
    private final String elementType;
    private final ContentHash contentHash;

    public StoryElementNode(EntityIdentifier id, String elementType, ContentHash contentHash) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.elementType = elementType;
        this.contentHash = contentHash;
    }

    public EntityIdentifier getId() {
        return id;
    }

    public String getElementType() {
        return elementType;
    }

    public ContentHash getContentHash() {
        return contentHash;
    }

    /**
     * Applies {@code update} on top of this node.
     *
     * @throws IllegalArgumentException if the update targets another node
     */
    public StoryElementNode merge(StoryElementNode update) {
        if (!id.equals(update.id)) {
            throw new IllegalArgumentException("Cannot merge node " + update.id + " into " + id);
        }
        return new StoryElementNode(
                id,
                update.elementType != null ? update.elementType : elementType,
                update.contentHash != null ? update.contentHash : contentHash);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoryElementNode that = (StoryElementNode) o;
        return id.equals(that.id)
                && Objects.equals(elementType, that.elementType)
                && Objects.equals(contentHash, that.contentHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, elementType, contentHash);
    }

    @Override
    public String toString() {
        return "StoryElementNode{" +
                "id=" + id +
                ", elementType='" + elementType + '\'' +
                ", contentHash=" + contentHash +
                '}';
    }
}
