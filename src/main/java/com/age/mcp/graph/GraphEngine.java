package com.age.mcp.graph;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Pooled source of JDBC connections for one {@link ConnectionSettings} target.
 * Creating an engine performs no I/O; the pool opens connections on demand.
 */
public interface GraphEngine extends AutoCloseable {

    /**
     * Borrows a connection from the pool. Closing the returned connection hands it back.
     *
     * @throws SQLException if no connection can be obtained within the connection timeout
     */
    Connection getConnection() throws SQLException;

    /**
     * Settings this engine was built from.
     */
    ConnectionSettings getSettings();

    PoolStats getStats();

    boolean isClosed();

    /**
     * Closes every pooled connection. Further calls are no-ops.
     */
    @Override
    void close();
}
