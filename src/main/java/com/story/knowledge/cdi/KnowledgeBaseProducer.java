package com.story.knowledge.cdi;

import com.story.knowledge.api.KnowledgeBaseOptions;
import com.story.knowledge.api.UnifiedKnowledgeBase;
import com.story.knowledge.graph.PoolConfig;
import com.story.knowledge.transaction.ConflictPolicy;
import com.story.knowledge.vector.OllamaEmbeddingProvider;
import com.story.knowledge.vector.QdrantVectorStoreAdapter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the knowledge base from MicroProfile Config properties.
 *
 * <p>In a CDI container (e.g., Quarkus) this reads {@code story-knowledge.*}
 * properties and produces a {@link UnifiedKnowledgeBase} backed by FalkorDB and
 * Qdrant, with Ollama computing embeddings.</p>
 *
 * <pre>
 * story-knowledge:
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *   qdrant:
 *     base-url: http://localhost:6333
 *     collection: story_elements
 * </pre>
 */
@ApplicationScoped
public class KnowledgeBaseProducer {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "story-knowledge.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "story-knowledge.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "story-knowledge.falkordb.graph-name", defaultValue = "story-knowledge")
    String falkordbGraphName;

    @Inject
    @ConfigProperty(name = "story-knowledge.pool.max-total", defaultValue = "16")
    int poolMaxTotal;

    @Inject
    @ConfigProperty(name = "story-knowledge.pool.max-idle", defaultValue = "8")
    int poolMaxIdle;

    @Inject
    @ConfigProperty(name = "story-knowledge.pool.max-wait-millis", defaultValue = "5000")
    long poolMaxWaitMillis;

    // ── Qdrant / Ollama ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "story-knowledge.qdrant.base-url", defaultValue = "http://localhost:6333")
    String qdrantBaseUrl;

    @Inject
    @ConfigProperty(name = "story-knowledge.qdrant.collection", defaultValue = "story_elements")
    String qdrantCollection;

    @Inject
    @ConfigProperty(name = "story-knowledge.qdrant.api-key")
    Optional<String> qdrantApiKey;

    @Inject
    @ConfigProperty(name = "story-knowledge.qdrant.vector-size", defaultValue = "768")
    int qdrantVectorSize;

    @Inject
    @ConfigProperty(name = "story-knowledge.embedding.ollama.base-url", defaultValue = "http://localhost:11434")
    String ollamaBaseUrl;

    @Inject
    @ConfigProperty(name = "story-knowledge.embedding.ollama.model", defaultValue = "nomic-embed-text")
    String ollamaModel;

    @Inject
    @ConfigProperty(name = "story-knowledge.embedding.ollama.timeout-seconds", defaultValue = "30")
    int ollamaTimeoutSeconds;

    // ── Transactions ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "story-knowledge.transaction.prepare-timeout-millis", defaultValue = "10000")
    long prepareTimeoutMillis;

    @Inject
    @ConfigProperty(name = "story-knowledge.transaction.commit-timeout-millis", defaultValue = "10000")
    long commitTimeoutMillis;

    @Inject
    @ConfigProperty(name = "story-knowledge.transaction.max-prepare-attempts", defaultValue = "3")
    int maxPrepareAttempts;

    @Inject
    @ConfigProperty(name = "story-knowledge.transaction.conflict-policy", defaultValue = "WAIT")
    String conflictPolicy;

    @Inject
    @ConfigProperty(name = "story-knowledge.transaction.lock-wait-millis", defaultValue = "5000")
    long lockWaitMillis;

    @Inject
    @ConfigProperty(name = "story-knowledge.registry.cache-size", defaultValue = "10000")
    long identifierCacheSize;

    @Inject
    @ConfigProperty(name = "story-knowledge.reconciliation.interval-seconds", defaultValue = "0")
    long reconciliationIntervalSeconds;

    @Produces
    @ApplicationScoped
    public UnifiedKnowledgeBase knowledgeBase() {
        log.info("Producing UnifiedKnowledgeBase: falkordb={}:{}/{} qdrant={}/{}",
                falkordbHost, falkordbPort, falkordbGraphName, qdrantBaseUrl, qdrantCollection);

        PoolConfig poolConfig = PoolConfig.builder()
                .host(falkordbHost)
                .port(falkordbPort)
                .graphName(falkordbGraphName)
                .maxTotal(poolMaxTotal)
                .maxIdle(poolMaxIdle)
                .maxWaitMillis(poolMaxWaitMillis)
                .build();

        QdrantVectorStoreAdapter vectorStore = QdrantVectorStoreAdapter.builder()
                .baseUrl(qdrantBaseUrl)
                .collection(qdrantCollection)
                .apiKey(qdrantApiKey.orElse(null))
                .embeddingProvider(OllamaEmbeddingProvider.builder()
                        .baseUrl(ollamaBaseUrl)
                        .model(ollamaModel)
                        .timeout(Duration.ofSeconds(ollamaTimeoutSeconds))
                        .build())
                .build();
        vectorStore.ensureCollection(qdrantVectorSize);

        KnowledgeBaseOptions options = KnowledgeBaseOptions.builder()
                .prepareTimeout(Duration.ofMillis(prepareTimeoutMillis))
                .commitTimeout(Duration.ofMillis(commitTimeoutMillis))
                .maxPrepareAttempts(maxPrepareAttempts)
                .conflictPolicy(ConflictPolicy.valueOf(conflictPolicy.toUpperCase()))
                .lockWait(Duration.ofMillis(lockWaitMillis))
                .identifierCacheSize(identifierCacheSize)
                .build();

        UnifiedKnowledgeBase knowledgeBase = UnifiedKnowledgeBase.builder()
                .falkorDBPool(poolConfig)
                .vectorStore(vectorStore)
                .options(options)
                .build();

        if (reconciliationIntervalSeconds > 0) {
            knowledgeBase.reconciliation().start(Duration.ofSeconds(reconciliationIntervalSeconds));
        }
        return knowledgeBase;
    }

    public void closeKnowledgeBase(@Disposes UnifiedKnowledgeBase knowledgeBase) {
        log.info("Closing UnifiedKnowledgeBase");
        knowledgeBase.close();
    }
}
