package com.age.mcp.graph;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link GraphEngine} backed by a HikariCP pool and the PostgreSQL JDBC driver.
 *
 * <p>The pool is started by the first {@link #getConnection()}, so constructing an engine
 * never touches the network. HikariCP always validates idle connections before handing
 * them out, so {@code pool_pre_ping} needs no mapping.</p>
 */
public class HikariGraphEngine implements GraphEngine {
    private static final Logger log = LoggerFactory.getLogger(HikariGraphEngine.class);

    static final String POSTGRES_DRIVER = "org.postgresql.Driver";
    static final String APPLICATION_NAME = "age-mcp";

    private final ConnectionSettings settings;
    private final HikariDataSource dataSource;

    public HikariGraphEngine(ConnectionSettings settings) {
        this.settings = settings;
        HikariConfig config = buildHikariConfig(settings);
        // no-arg constructor defers pool start to the first getConnection()
        this.dataSource = new HikariDataSource();
        config.copyStateTo(dataSource);
        log.debug("engine.configured name={} dsn={} maxPoolSize={}",
                settings.getName(), settings.getDsn().toSafeString(), config.getMaximumPoolSize());
    }

    /**
     * Translates settings into a HikariCP configuration.
     *
     * @throws ValidationException if the DSN cannot be turned into a JDBC URL
     */
    static HikariConfig buildHikariConfig(ConnectionSettings settings) {
        DataSourceName dsn = settings.getDsn();
        Map<String, Object> params = settings.deriveEngineParameters();

        HikariConfig config = new HikariConfig();
        config.setPoolName("age-mcp-" + settings.getName());
        config.setJdbcUrl(dsn.toJdbcUrl());
        config.setUsername(dsn.getUsername());
        config.setPassword(dsn.getPassword());
        config.setReadOnly(settings.isReadonly());

        Integer poolSize = (Integer) params.get(ConnectionSettings.PARAM_POOL_SIZE);
        Integer maxOverflow = (Integer) params.get(ConnectionSettings.PARAM_MAX_OVERFLOW);
        if (poolSize != null) {
            config.setMinimumIdle(poolSize);
            int overflow = maxOverflow != null ? maxOverflow : 0;
            config.setMaximumPoolSize(Math.max(1, poolSize + overflow));
        }

        Integer poolTimeout = (Integer) params.get(ConnectionSettings.PARAM_POOL_TIMEOUT);
        if (poolTimeout != null) {
            config.setConnectionTimeout(TimeUnit.SECONDS.toMillis(poolTimeout));
        }
        Integer recycle = (Integer) params.get(ConnectionSettings.PARAM_POOL_RECYCLE);
        Integer lifetime = recycle != null ? recycle : settings.getPoolMaxLifetime();
        if (lifetime != null) {
            config.setMaxLifetime(TimeUnit.SECONDS.toMillis(lifetime));
        }
        if (settings.getPoolMaxIdleTime() != null) {
            config.setIdleTimeout(TimeUnit.SECONDS.toMillis(settings.getPoolMaxIdleTime()));
        }
        if (settings.isKeepalives() && settings.getKeepalivesIdle() != null) {
            config.setKeepaliveTime(TimeUnit.SECONDS.toMillis(settings.getKeepalivesIdle()));
        }

        String dialect = dsn.getDialect();
        if ("postgresql".equals(dialect) || "postgres".equals(dialect)) {
            config.setDriverClassName(POSTGRES_DRIVER);
            config.addDataSourceProperty("ApplicationName", APPLICATION_NAME);
            config.addDataSourceProperty("tcpKeepAlive", String.valueOf(settings.isKeepalives()));
            String options = startupOptions(settings);
            if (!options.isEmpty()) {
                config.addDataSourceProperty("options", options);
            }
        }
        return config;
    }

    static String startupOptions(ConnectionSettings settings) {
        StringBuilder options = new StringBuilder();
        if (settings.getTimezone() != null) {
            options.append("-c TimeZone=").append(settings.getTimezone());
        }
        if (settings.getCommandTimeout() != null) {
            if (options.length() > 0) {
                options.append(' ');
            }
            options.append("-c statement_timeout=").append(TimeUnit.SECONDS.toMillis(settings.getCommandTimeout()));
        }
        return options.toString();
    }

    @Override
    public Connection getConnection() throws SQLException {
        if (dataSource.isClosed()) {
            throw new SQLException("Engine '" + settings.getName() + "' is closed");
        }
        return dataSource.getConnection();
    }

    @Override
    public ConnectionSettings getSettings() {
        return settings;
    }

    @Override
    public PoolStats getStats() {
        int max = dataSource.getMaximumPoolSize();
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        if (pool == null) {
            return PoolStats.empty(max);
        }
        return new PoolStats(
                pool.getTotalConnections(),
                pool.getActiveConnections(),
                pool.getIdleConnections(),
                pool.getThreadsAwaitingConnection(),
                max
        );
    }

    @Override
    public boolean isClosed() {
        return dataSource.isClosed();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            log.info("engine.closing name={}", settings.getName());
            dataSource.close();
        }
    }

    @Override
    public String toString() {
        return "HikariGraphEngine{name='" + settings.getName() + "', dsn='" + settings.getDsn().toSafeString() + "'}";
    }
}
