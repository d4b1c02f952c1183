package com.story.knowledge.metrics;

import com.story.knowledge.core.model.StoreSide;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordTransactionDuration("COMMITTED", Duration.ofMillis(100));
                noOp.incrementPrepareRetry(StoreSide.GRAPH);
                noOp.incrementAborted(StoreSide.VECTOR);
                noOp.incrementPartialCommit(StoreSide.VECTOR);
                noOp.incrementLockConflict();
                noOp.incrementReconciliationResolved();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record transaction duration per outcome")
        void recordTransactionDuration() {
            metrics.recordTransactionDuration("COMMITTED", Duration.ofMillis(150));
            metrics.recordTransactionDuration("COMMITTED", Duration.ofMillis(250));
            metrics.recordTransactionDuration("ROLLED_BACK", Duration.ofMillis(10));

            Timer committed = registry.find("knowledge.transaction.duration").tag("outcome", "COMMITTED").timer();
            Timer rolledBack = registry.find("knowledge.transaction.duration").tag("outcome", "ROLLED_BACK").timer();

            assertNotNull(committed);
            assertEquals(2, committed.count());
            assertNotNull(rolledBack);
            assertEquals(1, rolledBack.count());
        }

        @Test
        @DisplayName("Should count prepare retries per side")
        void incrementPrepareRetry() {
            metrics.incrementPrepareRetry(StoreSide.GRAPH);
            metrics.incrementPrepareRetry(StoreSide.GRAPH);
            metrics.incrementPrepareRetry(StoreSide.VECTOR);

            assertEquals(2.0, registry.find("knowledge.prepare.retries").tag("side", "GRAPH").counter().count());
            assertEquals(1.0, registry.find("knowledge.prepare.retries").tag("side", "VECTOR").counter().count());
        }

        @Test
        @DisplayName("Should tag aborts with UNKNOWN when no side failed")
        void incrementAbortedWithoutSide() {
            metrics.incrementAborted(null);

            Counter counter = registry.find("knowledge.transaction.aborted").tag("side", "UNKNOWN").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("Should count partial commits by failed side")
        void incrementPartialCommit() {
            metrics.incrementPartialCommit(StoreSide.VECTOR);

            Counter counter = registry.find("knowledge.transaction.partial").tag("failedSide", "VECTOR").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("Should count lock conflicts and resolved reconciliations")
        void plainCounters() {
            metrics.incrementLockConflict();
            metrics.incrementReconciliationResolved();
            metrics.incrementReconciliationResolved();

            assertEquals(1.0, registry.find("knowledge.lock.conflicts").counter().count());
            assertEquals(2.0, registry.find("knowledge.reconciliation.resolved").counter().count());
        }
    }
}
