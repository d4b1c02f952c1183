package com.story.knowledge.registry;

import com.story.knowledge.core.model.EntityIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link EntityIdentifierRegistry}.
 * {@link ConcurrentHashMap#computeIfAbsent} runs the allocation once per key.
 */
public class InMemoryEntityIdentifierRegistry implements EntityIdentifierRegistry {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityIdentifierRegistry.class);

    private final ConcurrentMap<NaturalKey, EntityIdentifier> identifiers = new ConcurrentHashMap<>();
    private final Supplier<EntityIdentifier> idGenerator;

    public InMemoryEntityIdentifierRegistry() {
        this(EntityIdentifier::generate);
    }

    public InMemoryEntityIdentifierRegistry(Supplier<EntityIdentifier> idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public EntityIdentifier resolveOrCreate(NaturalKey key) {
        return identifiers.computeIfAbsent(key, k -> {
            EntityIdentifier id = idGenerator.get();
            log.debug("Allocated identifier {} for key {}", id, k);
            return id;
        });
    }

    @Override
    public Optional<EntityIdentifier> find(NaturalKey key) {
        return Optional.ofNullable(identifiers.get(key));
    }

    @Override
    public long size() {
        return identifiers.size();
    }
}
