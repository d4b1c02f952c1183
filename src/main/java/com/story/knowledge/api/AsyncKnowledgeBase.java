package com.story.knowledge.api;

import com.story.knowledge.core.model.EntityIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each {@code updateStoryElement} on its own task of a bounded worker pool.
 *
 * <p>The timeout bounds how long the returned future waits. It does not cancel
 * the underlying write, which still ends in a definite transaction state and
 * releases its lock.</p>
 */
public class AsyncKnowledgeBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncKnowledgeBase.class);

    private final UnifiedKnowledgeBase knowledgeBase;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncKnowledgeBase(UnifiedKnowledgeBase knowledgeBase, int poolSize, Duration timeout) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive");
        }
        this.knowledgeBase = knowledgeBase;
        this.executor = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
        this.timeoutMs = timeout.toMillis();
    }

    public CompletableFuture<EntityIdentifier> updateStoryElementAsync(String elementType, String content,
                                                                       List<RelationshipRequest> relationships) {
        return updateAsync(StoryElementUpdate.of(elementType, content, relationships));
    }

    public CompletableFuture<EntityIdentifier> updateAsync(StoryElementUpdate update) {
        return CompletableFuture.supplyAsync(() -> knowledgeBase.update(update), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Submits every update and completes when all of them did, in submission order.
     * Fails with the first failure.
     */
    public CompletableFuture<List<EntityIdentifier>> updateAllAsync(List<StoryElementUpdate> updates) {
        List<CompletableFuture<EntityIdentifier>> futures = updates.stream()
                .map(this::updateAsync)
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Async workers did not finish within {}ms, interrupting", timeoutMs);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "story-knowledge-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
