package com.story.knowledge.api;

import com.story.knowledge.core.exception.KnowledgeBaseException;
import com.story.knowledge.core.exception.ValidationException;
import com.story.knowledge.core.model.ChangeEvent;
import com.story.knowledge.core.model.ContentHash;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.Relationship;
import com.story.knowledge.core.model.StoryElementNode;
import com.story.knowledge.graph.FalkorDBGraphStoreAdapter;
import com.story.knowledge.graph.GraphConnection;
import com.story.knowledge.graph.GraphConnectionPool;
import com.story.knowledge.graph.InputSanitizer;
import com.story.knowledge.graph.PoolConfig;
import com.story.knowledge.graph.PooledFalkorDBConnection;
import com.story.knowledge.graph.SimpleGraphConnectionPool;
import com.story.knowledge.ledger.ChangeEventLedger;
import com.story.knowledge.ledger.GraphChangeEventLedger;
import com.story.knowledge.ledger.InMemoryChangeEventLedger;
import com.story.knowledge.lock.DistributedLock;
import com.story.knowledge.lock.LocalDistributedLock;
import com.story.knowledge.metrics.MetricsService;
import com.story.knowledge.metrics.NoOpMetricsService;
import com.story.knowledge.reconcile.ReconciliationService;
import com.story.knowledge.registry.CachingEntityIdentifierRegistry;
import com.story.knowledge.registry.EntityIdentifierRegistry;
import com.story.knowledge.registry.GraphEntityIdentifierRegistry;
import com.story.knowledge.registry.InMemoryEntityIdentifierRegistry;
import com.story.knowledge.registry.NaturalKey;
import com.story.knowledge.store.GraphOperation;
import com.story.knowledge.store.GraphStoreAdapter;
import com.story.knowledge.store.VectorEntry;
import com.story.knowledge.store.VectorStoreAdapter;
import com.story.knowledge.store.memory.InMemoryGraphStore;
import com.story.knowledge.store.memory.InMemoryVectorStore;
import com.story.knowledge.transaction.TransactionCoordinator;
import com.story.knowledge.transaction.TransactionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point for writing story elements to the graph store and the vector
 * store as one operation.
 *
 * <pre>
 * try (UnifiedKnowledgeBase kb = UnifiedKnowledgeBase.builder()
 *         .falkorDBPool(PoolConfig.builder().host("localhost").build())
 *         .vectorStore(qdrantAdapter)
 *         .build()) {
 *     EntityIdentifier sarah = kb.updateStoryElement("character", "Sarah enters the room.", List.of());
 * }
 * </pre>
 *
 * <p>Errors surface unchanged from the coordinator: {@code isSafeToRetry()} tells
 * "nothing happened" apart from "reconciliation required".</p>
 */
public class UnifiedKnowledgeBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UnifiedKnowledgeBase.class);

    private final GraphStoreAdapter graphStore;
    private final VectorStoreAdapter vectorStore;
    private final EntityIdentifierRegistry registry;
    private final ChangeEventLedger ledger;
    private final TransactionCoordinator coordinator;
    private final ReconciliationService reconciliationService;
    private final KnowledgeBaseOptions options;
    private final GraphConnectionPool ownedPool;

    private UnifiedKnowledgeBase(Builder builder) {
        this.options = builder.options;
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        DistributedLock lock = builder.distributedLock != null ? builder.distributedLock : new LocalDistributedLock();

        this.ownedPool = builder.ownedPool;
        GraphConnection bookkeeping = ownedPool != null ? new PooledFalkorDBConnection(ownedPool) : null;
        if (bookkeeping != null && builder.createIndexes) {
            bookkeeping.ensureIndexes();
        }

        this.graphStore = builder.graphStore != null ? builder.graphStore
                : ownedPool != null ? new FalkorDBGraphStoreAdapter(ownedPool) : new InMemoryGraphStore();
        this.vectorStore = builder.vectorStore != null ? builder.vectorStore : new InMemoryVectorStore();

        EntityIdentifierRegistry baseRegistry = builder.registry != null ? builder.registry
                : bookkeeping != null ? new GraphEntityIdentifierRegistry(bookkeeping)
                : new InMemoryEntityIdentifierRegistry();
        this.registry = options.getIdentifierCacheSize() > 0
                ? new CachingEntityIdentifierRegistry(baseRegistry, options.getIdentifierCacheSize())
                : baseRegistry;
        this.ledger = builder.ledger != null ? builder.ledger
                : bookkeeping != null ? new GraphChangeEventLedger(bookkeeping)
                : new InMemoryChangeEventLedger();

        this.coordinator = new TransactionCoordinator(graphStore, vectorStore, ledger, lock,
                options.toCoordinatorConfig(), metrics);
        this.reconciliationService = new ReconciliationService(coordinator, ledger, metrics);

        log.info("UnifiedKnowledgeBase initialized: graph={}, vector={}", graphStore.getName(), vectorStore.getName());
    }

    // ========== Write API ==========

    /**
     * Writes a story element keyed by its type and content.
     *
     * @return the element's canonical identifier; identical content yields the same identifier
     */
    public EntityIdentifier updateStoryElement(String elementType, String content,
                                               List<RelationshipRequest> relationships) {
        return write(elementType, null, content, relationships);
    }

    public EntityIdentifier updateStoryElement(String elementType, String content) {
        return write(elementType, null, content, List.of());
    }

    /**
     * Writes a story element keyed by a caller-supplied key, so that new content
     * updates the same element instead of creating another one.
     */
    public EntityIdentifier updateStoryElement(String elementType, String explicitKey, String content,
                                               List<RelationshipRequest> relationships) {
        if (explicitKey == null || explicitKey.isBlank()) {
            throw new ValidationException("Explicit key must not be null or blank");
        }
        return write(elementType, explicitKey, content, relationships);
    }

    public EntityIdentifier update(StoryElementUpdate update) {
        return write(update.elementType(), update.explicitKey(), update.content(), update.relationships());
    }

    private EntityIdentifier write(String elementType, String explicitKey, String content,
                                   List<RelationshipRequest> relationships) {
        InputSanitizer.validateElementType(elementType);
        ContentHash hash = ContentHash.of(content);
        List<RelationshipRequest> requested = relationships != null ? relationships : List.of();
        if (requested.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("Relationships must not contain null");
        }

        NaturalKey key = explicitKey != null
                ? NaturalKey.explicit(elementType, explicitKey)
                : NaturalKey.ofContent(elementType, hash);
        EntityIdentifier id = registry.resolveOrCreate(key);

        TransactionHandle handle = coordinator.begin(id);
        try {
            coordinator.stageVectorOp(handle, new VectorEntry(id, content, Map.of("type", elementType)));
            coordinator.stageGraphOp(handle, new GraphOperation.UpsertNode(new StoryElementNode(id, elementType, hash)));
            for (RelationshipRequest request : requested) {
                coordinator.stageGraphOp(handle, new GraphOperation.UpsertRelationship(
                        Relationship.of(id, request.target(), request.type())));
            }
            coordinator.prepare(handle);
            coordinator.commit(handle);
            log.debug("story.element.updated entityId={} type={} relationships={}", id, elementType, requested.size());
            return id;
        } catch (RuntimeException e) {
            if (!handle.getState().isTerminal()) {
                try {
                    coordinator.rollback(handle);
                } catch (KnowledgeBaseException rollbackFailure) {
                    rollbackFailure.addSuppressed(e);
                    throw rollbackFailure;
                }
            }
            throw e;
        }
    }

    // ========== Read API ==========

    public Optional<StoryElementNode> findNode(EntityIdentifier id) {
        return graphStore.findNode(id);
    }

    public List<Relationship> findRelationships(EntityIdentifier sourceId) {
        return graphStore.findRelationships(sourceId);
    }

    public Optional<VectorEntry> findVectorEntry(EntityIdentifier id) {
        return vectorStore.find(id);
    }

    public Optional<EntityIdentifier> findIdentifier(NaturalKey key) {
        return registry.find(key);
    }

    /**
     * Every ledgered change of an element, in append order.
     */
    public List<ChangeEvent> history(EntityIdentifier id) {
        return ledger.history(id);
    }

    // ========== Components ==========

    public TransactionCoordinator getCoordinator() {
        return coordinator;
    }

    public ChangeEventLedger getLedger() {
        return ledger;
    }

    public EntityIdentifierRegistry getRegistry() {
        return registry;
    }

    public ReconciliationService reconciliation() {
        return reconciliationService;
    }

    public KnowledgeBaseOptions getOptions() {
        return options;
    }

    /**
     * Async facade running each update on a bounded worker pool. The caller owns
     * (and closes) the returned instance.
     */
    public AsyncKnowledgeBase async() {
        return new AsyncKnowledgeBase(this, options.getAsyncPoolSize(), options.getAsyncTimeout());
    }

    @Override
    public void close() {
        reconciliationService.close();
        closeQuietly(vectorStore);
        closeQuietly(graphStore);
        if (ownedPool != null) {
            ownedPool.close();
        }
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", closeable, e.getMessage());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphStoreAdapter graphStore;
        private VectorStoreAdapter vectorStore;
        private EntityIdentifierRegistry registry;
        private ChangeEventLedger ledger;
        private DistributedLock distributedLock;
        private MetricsService metricsService;
        private KnowledgeBaseOptions options = KnowledgeBaseOptions.defaults();
        private GraphConnectionPool ownedPool;
        private boolean createIndexes = true;

        /**
         * Sets the graph store. Defaults to {@link InMemoryGraphStore}.
         */
        public Builder graphStore(GraphStoreAdapter graphStore) {
            this.graphStore = graphStore;
            return this;
        }

        /**
         * Sets the vector store. Defaults to {@link InMemoryVectorStore}.
         */
        public Builder vectorStore(VectorStoreAdapter vectorStore) {
            this.vectorStore = vectorStore;
            return this;
        }

        /**
         * Creates a FalkorDB connection pool owned by the knowledge base. Unless set
         * explicitly, the graph store, the identifier registry and the ledger all
         * use it.
         */
        public Builder falkorDBPool(PoolConfig poolConfig) {
            this.ownedPool = new SimpleGraphConnectionPool(poolConfig);
            return this;
        }

        /**
         * Same as {@link #falkorDBPool(PoolConfig)} with a pool built by the caller.
         * The knowledge base takes ownership and closes it.
         */
        public Builder connectionPool(GraphConnectionPool pool) {
            this.ownedPool = pool;
            return this;
        }

        /**
         * Whether the story element, identifier and ledger indexes are created on
         * build when a FalkorDB pool is configured. Defaults to {@code true}.
         */
        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder registry(EntityIdentifierRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder ledger(ChangeEventLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        /**
         * Sets the per-entity lock. Defaults to {@link LocalDistributedLock}.
         */
        public Builder distributedLock(DistributedLock distributedLock) {
            this.distributedLock = distributedLock;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder options(KnowledgeBaseOptions options) {
            this.options = options;
            return this;
        }

        public UnifiedKnowledgeBase build() {
            if (options == null) {
                throw new IllegalStateException("options are required");
            }
            return new UnifiedKnowledgeBase(this);
        }
    }
}
