package com.age.mcp.graph;

import com.age.mcp.metrics.MetricsService;
import com.age.mcp.metrics.NoOpMetricsService;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens {@link GraphSession}s on one engine.
 *
 * <p>Objects read through a session are plain immutable values, so nothing is expired
 * when a transaction commits and records stay usable afterwards.</p>
 */
public class SessionFactory {

    private final GraphEngine engine;
    private final MetricsService metrics;

    public SessionFactory(GraphEngine engine) {
        this(engine, new NoOpMetricsService());
    }

    public SessionFactory(GraphEngine engine, MetricsService metrics) {
        this.engine = engine;
        this.metrics = metrics;
    }

    /**
     * Opens a session with auto-commit disabled. The caller owns the session and must close it.
     *
     * @throws SQLException if no pooled connection is available
     */
    public GraphSession openSession() throws SQLException {
        Connection connection = engine.getConnection();
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return new GraphSession(connection, engine.getSettings(), metrics);
    }

    public GraphEngine getEngine() {
        return engine;
    }

    public boolean isExpireOnCommit() {
        return false;
    }
}
