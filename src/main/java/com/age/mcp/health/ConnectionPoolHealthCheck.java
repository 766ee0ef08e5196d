package com.age.mcp.health;

import com.age.mcp.graph.ConnectionLifecycleManager;
import com.age.mcp.graph.ExecutionContext;
import com.age.mcp.graph.PoolStats;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reports the utilization of every engine pool owned by a {@link ConnectionLifecycleManager}.
 * The busiest pool decides the status: DEGRADED from 80% of its maximum size, DOWN when
 * every connection is in use.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    static final double DOWN_THRESHOLD = 1.0;
    static final double DEGRADED_THRESHOLD = 0.80;

    private final ConnectionLifecycleManager manager;

    public ConnectionPoolHealthCheck(ConnectionLifecycleManager manager) {
        this.manager = manager;
    }

    @Override
    public String getName() {
        return "connectionPools";
    }

    @Override
    public HealthStatus check() {
        try {
            double peak = 0.0;
            String busiest = null;
            int active = 0;
            int idle = 0;
            int pending = 0;
            Map<String, Object> perContext = new LinkedHashMap<>();

            for (ExecutionContext ctx : manager.activeContexts()) {
                Optional<PoolStats> maybeStats = manager.poolStats(ctx);
                if (maybeStats.isEmpty()) {
                    // disposed since activeContexts() was read
                    continue;
                }
                PoolStats stats = maybeStats.get();
                active += stats.activeConnections();
                idle += stats.idleConnections();
                pending += stats.pendingThreads();
                perContext.put(ctx.getId(), stats.activeConnections() + "/" + stats.maxConnections());
                if (stats.utilization() >= peak) {
                    peak = stats.utilization();
                    busiest = ctx.getId();
                }
            }

            HealthStatus base;
            if (perContext.isEmpty()) {
                base = HealthStatus.up("No engines open");
            } else if (peak >= DOWN_THRESHOLD) {
                base = HealthStatus.down("Connection pool exhausted in context " + busiest);
            } else if (peak >= DEGRADED_THRESHOLD) {
                base = HealthStatus.degraded("Connection pool usage high in context " + busiest + ": "
                        + String.format("%.0f%%", peak * 100));
            } else {
                base = HealthStatus.up();
            }

            return base
                    .withDetail("connection", manager.getSettings().getName())
                    .withDetail("contexts", perContext.size())
                    .withDetail("activeConnections", active)
                    .withDetail("idleConnections", idle)
                    .withDetail("pendingThreads", pending)
                    .withDetail("pools", perContext);
        } catch (Exception e) {
            return HealthStatus.down("Connection pool check failed: " + e.getMessage());
        }
    }
}
