package com.story.knowledge.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.story.knowledge.core.model.EntityIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed read-through cache in front of another registry.
 * Identifiers are never reassigned, so entries never go stale and need no TTL.
 */
public class CachingEntityIdentifierRegistry implements EntityIdentifierRegistry {
    private static final Logger log = LoggerFactory.getLogger(CachingEntityIdentifierRegistry.class);

    private final EntityIdentifierRegistry delegate;
    private final Cache<NaturalKey, EntityIdentifier> cache;

    public CachingEntityIdentifierRegistry(EntityIdentifierRegistry delegate, long maxSize) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
        log.info("CachingEntityIdentifierRegistry initialized: maxSize={}", maxSize);
    }

    @Override
    public EntityIdentifier resolveOrCreate(NaturalKey key) {
        return cache.get(key, delegate::resolveOrCreate);
    }

    @Override
    public Optional<EntityIdentifier> find(NaturalKey key) {
        EntityIdentifier cached = cache.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<EntityIdentifier> found = delegate.find(key);
        found.ifPresent(id -> cache.put(key, id));
        return found;
    }

    @Override
    public long size() {
        return delegate.size();
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }
}
