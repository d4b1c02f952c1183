package com.story.knowledge.integration;

import com.story.knowledge.api.KnowledgeBaseOptions;
import com.story.knowledge.api.UnifiedKnowledgeBase;
import com.story.knowledge.graph.PoolConfig;
import com.story.knowledge.store.VectorStoreAdapter;
import org.junit.jupiter.api.Tag;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

/**
 * Base class for FalkorDB integration tests using Testcontainers.
 * Provides a shared FalkorDB container and helpers for creating knowledge
 * bases on isolated graph names. The vector side stays in memory.
 */
@Tag("integration")
@Testcontainers
abstract class AbstractFalkorDBIntegrationTest {

    private static final int FALKORDB_PORT = 6379;

    @SuppressWarnings("resource")
    @Container
    static final GenericContainer<?> falkorDB = new GenericContainer<>("falkordb/falkordb:latest")
            .withExposedPorts(FALKORDB_PORT);

    protected static String uniqueGraphName(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Creates a knowledge base whose graph store, identifier registry and ledger
     * all live in {@code graphName}.
     */
    protected UnifiedKnowledgeBase createKnowledgeBase(String graphName, VectorStoreAdapter vectorStore) {
        return UnifiedKnowledgeBase.builder()
                .falkorDBPool(PoolConfig.builder()
                        .host(falkorDB.getHost())
                        .port(falkorDB.getMappedPort(FALKORDB_PORT))
                        .graphName(graphName)
                        .maxTotal(8)
                        .maxIdle(4)
                        .build())
                .vectorStore(vectorStore)
                .options(KnowledgeBaseOptions.builder().backoff(5, 50, 0.0).build())
                .build();
    }
}
