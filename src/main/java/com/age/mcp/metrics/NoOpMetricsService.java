package com.age.mcp.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}, used when no meter registry is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementEngineCreated(String connectionName) {
    }

    @Override
    public void incrementEngineDisposed(String connectionName, String reason) {
    }

    @Override
    public void recordTransactionDuration(String connectionName, TransactionOutcome outcome, Duration duration) {
    }

    @Override
    public void recordDecodeBatchSize(int rows) {
    }
}
