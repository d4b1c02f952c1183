package com.story.knowledge.vector;

import java.time.Duration;

/**
 * Turns text into an embedding vector.
 *
 * <p>Failures are reported as {@link com.story.knowledge.core.exception.TransientStoreException}
 * (unreachable, timeout, server error) or {@link com.story.knowledge.core.exception.StoreException}
 * against the vector side, since embedding is part of staging a vector upsert.</p>
 */
public interface EmbeddingProvider {

    /**
     * @param text    text to embed, never blank
     * @param timeout maximum time the call may take
     */
    float[] embed(String text, Duration timeout);

    String getProviderName();
}
