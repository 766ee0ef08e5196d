package com.age.mcp.metrics;

import java.time.Duration;

/**
 * Records connection lifecycle and decoding metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without Micrometer on the classpath.
 */
public interface MetricsService {

    void incrementEngineCreated(String connectionName);

    /**
     * @param reason {@code dispose}, {@code evicted} or {@code shutdown}
     */
    void incrementEngineDisposed(String connectionName, String reason);

    void recordTransactionDuration(String connectionName, TransactionOutcome outcome, Duration duration);

    /**
     * Number of rows handed to one batch decode.
     */
    void recordDecodeBatchSize(int rows);
}
