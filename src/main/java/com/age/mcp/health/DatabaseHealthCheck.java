package com.age.mcp.health;

import com.age.mcp.graph.ConnectionLifecycleManager;
import com.age.mcp.graph.ExecutionContext;

import java.util.List;
import java.util.Map;

/**
 * Checks that the database is reachable and has the Apache AGE extension installed.
 * Runs in its own execution context so probes never borrow from a worker's pool.
 */
public class DatabaseHealthCheck implements HealthCheck {

    static final String AGE_VERSION_QUERY = "SELECT extversion FROM pg_extension WHERE extname = 'age'";
    static final ExecutionContext HEALTH_CONTEXT = ExecutionContext.named("health");

    private final ConnectionLifecycleManager manager;

    public DatabaseHealthCheck(ConnectionLifecycleManager manager) {
        this.manager = manager;
    }

    @Override
    public String getName() {
        return "database";
    }

    @Override
    public HealthStatus check() {
        try {
            long startMs = System.currentTimeMillis();
            List<Map<String, Object>> rows = manager.scopedTransaction(HEALTH_CONTEXT,
                    session -> session.query(AGE_VERSION_QUERY));
            long latencyMs = System.currentTimeMillis() - startMs;

            if (rows.isEmpty()) {
                return HealthStatus.down("Apache AGE extension is not installed")
                        .withDetail("latencyMs", latencyMs);
            }
            return HealthStatus.up()
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("ageVersion", rows.get(0).get("extversion"))
                    .withDetail("connection", manager.getSettings().getName());
        } catch (Exception e) {
            return HealthStatus.down("Database check failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
