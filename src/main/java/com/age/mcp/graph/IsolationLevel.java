package com.age.mcp.graph;

import java.sql.Connection;
import java.util.Locale;

/**
 * Transaction isolation levels accepted by {@link ConnectionLifecycleManager#scopedTransaction}.
 */
public enum IsolationLevel {
    READ_UNCOMMITTED("READ UNCOMMITTED", Connection.TRANSACTION_READ_UNCOMMITTED),
    READ_COMMITTED("READ COMMITTED", Connection.TRANSACTION_READ_COMMITTED),
    REPEATABLE_READ("REPEATABLE READ", Connection.TRANSACTION_REPEATABLE_READ),
    SERIALIZABLE("SERIALIZABLE", Connection.TRANSACTION_SERIALIZABLE);

    private final String sqlName;
    private final int jdbcLevel;

    IsolationLevel(String sqlName, int jdbcLevel) {
        this.sqlName = sqlName;
        this.jdbcLevel = jdbcLevel;
    }

    public String getSqlName() {
        return sqlName;
    }

    /**
     * The matching {@code java.sql.Connection.TRANSACTION_*} constant.
     */
    public int getJdbcLevel() {
        return jdbcLevel;
    }

    /**
     * Resolves a level from its SQL name ({@code "REPEATABLE READ"}) or constant name
     * ({@code "repeatable_read"}), case-insensitively.
     *
     * @throws IllegalArgumentException if the name matches no level
     */
    public static IsolationLevel fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('_', ' ');
        for (IsolationLevel level : values()) {
            if (level.sqlName.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown isolation level: " + name);
    }
}
