package com.age.mcp.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Test
    @DisplayName("NoOpMetricsService should accept every call")
    void noOpCallable() {
        NoOpMetricsService noOp = new NoOpMetricsService();

        assertDoesNotThrow(() -> {
            noOp.incrementEngineCreated("main");
            noOp.incrementEngineDisposed("main", "dispose");
            noOp.recordTransactionDuration("main", TransactionOutcome.COMMITTED, Duration.ofMillis(5));
            noOp.recordDecodeBatchSize(10);
        });
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count created engines per connection")
        void engineCreated() {
            metrics.incrementEngineCreated("main");
            metrics.incrementEngineCreated("main");
            metrics.incrementEngineCreated("reports");

            Counter main = registry.find(MicrometerMetricsService.ENGINE_CREATED).tag("connection", "main").counter();
            assertNotNull(main);
            assertEquals(2.0, main.count());
        }

        @Test
        @DisplayName("Should tag disposed engines with the reason")
        void engineDisposed() {
            metrics.incrementEngineDisposed("main", "evicted");
            metrics.incrementEngineDisposed("main", "dispose");
            metrics.incrementEngineDisposed("main", "evicted");

            Counter evicted = registry.find(MicrometerMetricsService.ENGINE_DISPOSED)
                    .tag("reason", "evicted").counter();
            assertNotNull(evicted);
            assertEquals(2.0, evicted.count());
        }

        @Test
        @DisplayName("Should time transactions by outcome")
        void transactionDuration() {
            metrics.recordTransactionDuration("main", TransactionOutcome.COMMITTED, Duration.ofMillis(20));
            metrics.recordTransactionDuration("main", TransactionOutcome.ROLLED_BACK, Duration.ofMillis(30));
            metrics.recordTransactionDuration("main", TransactionOutcome.COMMITTED, Duration.ofMillis(40));

            Timer committed = registry.find(MicrometerMetricsService.TRANSACTION_DURATION)
                    .tag("outcome", "committed").timer();
            assertNotNull(committed);
            assertEquals(2, committed.count());
        }

        @Test
        @DisplayName("Should summarize decode batch sizes")
        void decodeBatchSize() {
            metrics.recordDecodeBatchSize(3);
            metrics.recordDecodeBatchSize(7);

            DistributionSummary summary = registry.find(MicrometerMetricsService.DECODE_BATCH_SIZE).summary();
            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(10.0, summary.totalAmount());
        }
    }
}
