package com.age.mcp.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code agemcp.engine.created}: Counter (tag: connection)</li>
 *   <li>{@code agemcp.engine.disposed}: Counter (tags: connection, reason)</li>
 *   <li>{@code agemcp.transaction.duration}: Timer (tags: connection, outcome)</li>
 *   <li>{@code agemcp.decode.batch.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    public static final String ENGINE_CREATED = "agemcp.engine.created";
    public static final String ENGINE_DISPOSED = "agemcp.engine.disposed";
    public static final String TRANSACTION_DURATION = "agemcp.transaction.duration";
    public static final String DECODE_BATCH_SIZE = "agemcp.decode.batch.size";

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder(DECODE_BATCH_SIZE)
                .description("Rows per agtype batch decode")
                .register(registry);
    }

    @Override
    public void incrementEngineCreated(String connectionName) {
        Counter counter = counterCache.computeIfAbsent("created:" + connectionName, k ->
                Counter.builder(ENGINE_CREATED)
                        .description("Number of engines built")
                        .tag("connection", connectionName)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementEngineDisposed(String connectionName, String reason) {
        Counter counter = counterCache.computeIfAbsent("disposed:" + connectionName + ":" + reason, k ->
                Counter.builder(ENGINE_DISPOSED)
                        .description("Number of engines closed")
                        .tag("connection", connectionName)
                        .tag("reason", reason)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordTransactionDuration(String connectionName, TransactionOutcome outcome, Duration duration) {
        String outcomeTag = outcome.name().toLowerCase(Locale.ROOT);
        Timer timer = timerCache.computeIfAbsent(connectionName + ":" + outcomeTag, k ->
                Timer.builder(TRANSACTION_DURATION)
                        .description("Duration of scoped transactions")
                        .tag("connection", connectionName)
                        .tag("outcome", outcomeTag)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordDecodeBatchSize(int rows) {
        batchSizeSummary.record(rows);
    }
}
