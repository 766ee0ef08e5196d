package com.age.mcp.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named configuration for one database target.
 *
 * <p>The DSN is denormalized into read/write accessors ({@link #getHost()},
 * {@link #setHost(String)}, ...). They write through to the {@link DataSourceName}
 * held by these settings, so {@code settings.setHost("x")} changes
 * {@code settings.getDsn().getHost()}.</p>
 *
 * <p>All durations are in seconds. A null optional value means "use the driver default".</p>
 */
public class ConnectionSettings {

    // Engine parameter names, see deriveEngineParameters()
    public static final String PARAM_ECHO = "echo";
    public static final String PARAM_POOL_SIZE = "pool_size";
    public static final String PARAM_MAX_OVERFLOW = "max_overflow";
    public static final String PARAM_POOL_TIMEOUT = "pool_timeout";
    public static final String PARAM_POOL_RECYCLE = "pool_recycle";
    public static final String PARAM_POOL_PRE_PING = "pool_pre_ping";
    public static final String PARAM_POOL_USE_LIFO = "pool_use_lifo";

    private static final Set<String> MAP_KEYS = Set.of(
            "name", "dsn", "echo", "encoding", "timezone", "readonly",
            "connection_timeout", "command_timeout",
            "pool_min_connections", "pool_max_connections", "pool_max_idle_time", "pool_max_lifetime",
            "pool_recycle_time", "pool_pre_ping", "pool_max_overflow",
            "keepalives", "keepalives_idle", "keepalives_interval", "keepalives_count");

    private final String name;
    private final DataSourceName dsn;

    private final boolean echo;
    private final String encoding;
    private final String timezone;
    private final boolean readonly;

    private final Integer connectionTimeout;
    private final Integer commandTimeout;

    private final Integer poolMinConnections;
    private final Integer poolMaxConnections;
    private final Integer poolMaxIdleTime;
    private final Integer poolMaxLifetime;
    private final Integer poolRecycleTime;
    private final boolean poolPrePing;
    private final Integer poolMaxOverflow;

    private final boolean keepalives;
    private final Integer keepalivesIdle;
    private final Integer keepalivesInterval;
    private final Integer keepalivesCount;

    private ConnectionSettings(Builder builder) {
        this.name = builder.name;
        this.dsn = builder.dsn;
        this.echo = builder.echo;
        this.encoding = builder.encoding;
        this.timezone = builder.timezone;
        this.readonly = builder.readonly;
        this.connectionTimeout = builder.connectionTimeout;
        this.commandTimeout = builder.commandTimeout;
        this.poolMinConnections = builder.poolMinConnections;
        this.poolMaxConnections = builder.poolMaxConnections;
        this.poolMaxIdleTime = builder.poolMaxIdleTime;
        this.poolMaxLifetime = builder.poolMaxLifetime;
        this.poolRecycleTime = builder.poolRecycleTime;
        this.poolPrePing = builder.poolPrePing;
        this.poolMaxOverflow = builder.poolMaxOverflow;
        this.keepalives = builder.keepalives;
        this.keepalivesIdle = builder.keepalivesIdle;
        this.keepalivesInterval = builder.keepalivesInterval;
        this.keepalivesCount = builder.keepalivesCount;
    }

    /**
     * Creates settings with defaults for everything but the name and DSN.
     */
    public static ConnectionSettings fromNameAndDsn(String name, String dsn) {
        return builder().name(name).dsn(dsn).build();
    }

    public static ConnectionSettings fromNameAndDsn(String name, DataSourceName dsn) {
        return builder().name(name).dsn(dsn).build();
    }

    /**
     * Creates settings from a configuration map with snake_case keys
     * ({@code name}, {@code dsn}, {@code pool_min_connections}, ...).
     * Numbers and booleans may be given as strings.
     *
     * @throws ValidationException for unknown keys, a {@code dsn} that is neither a string
     *                             nor a {@link DataSourceName}, or values of the wrong type
     */
    public static ConnectionSettings fromMap(Map<String, ?> values) {
        for (String key : values.keySet()) {
            if (!MAP_KEYS.contains(key)) {
                throw new ValidationException(key, "unknown connection setting");
            }
        }
        Builder builder = builder();
        builder.name(values.containsKey("name") ? String.valueOf(values.get("name")) : null);
        builder.dsnValue(values.get("dsn"));
        if (values.containsKey("echo")) builder.echo(toBool(values, "echo"));
        if (values.containsKey("encoding")) builder.encoding(String.valueOf(values.get("encoding")));
        if (values.containsKey("timezone")) builder.timezone(String.valueOf(values.get("timezone")));
        if (values.containsKey("readonly")) builder.readonly(toBool(values, "readonly"));
        if (values.containsKey("connection_timeout")) builder.connectionTimeout(toInt(values, "connection_timeout"));
        if (values.containsKey("command_timeout")) builder.commandTimeout(toInt(values, "command_timeout"));
        if (values.containsKey("pool_min_connections")) builder.poolMinConnections(toInt(values, "pool_min_connections"));
        if (values.containsKey("pool_max_connections")) builder.poolMaxConnections(toInt(values, "pool_max_connections"));
        if (values.containsKey("pool_max_idle_time")) builder.poolMaxIdleTime(toInt(values, "pool_max_idle_time"));
        if (values.containsKey("pool_max_lifetime")) builder.poolMaxLifetime(toInt(values, "pool_max_lifetime"));
        if (values.containsKey("pool_recycle_time")) builder.poolRecycleTime(toInt(values, "pool_recycle_time"));
        if (values.containsKey("pool_pre_ping")) builder.poolPrePing(toBool(values, "pool_pre_ping"));
        if (values.containsKey("pool_max_overflow")) builder.poolMaxOverflow(toInt(values, "pool_max_overflow"));
        if (values.containsKey("keepalives")) builder.keepalives(toBool(values, "keepalives"));
        if (values.containsKey("keepalives_idle")) builder.keepalivesIdle(toInt(values, "keepalives_idle"));
        if (values.containsKey("keepalives_interval")) builder.keepalivesInterval(toInt(values, "keepalives_interval"));
        if (values.containsKey("keepalives_count")) builder.keepalivesCount(toInt(values, "keepalives_count"));
        return builder.build();
    }

    /**
     * Maps the pooling and timeout settings onto engine parameter names.
     * Parameters without a value are left out so the pool falls back to its own default.
     * The pool always hands out connections first-in-first-out.
     *
     * @return ordered parameter map, keys from the {@code PARAM_*} constants
     */
    public Map<String, Object> deriveEngineParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(PARAM_ECHO, echo);
        params.put(PARAM_POOL_SIZE, poolMinConnections);
        params.put(PARAM_MAX_OVERFLOW, poolMaxOverflow);
        params.put(PARAM_POOL_TIMEOUT, connectionTimeout);
        params.put(PARAM_POOL_RECYCLE, poolRecycleTime);
        params.put(PARAM_POOL_PRE_PING, poolPrePing);
        params.put(PARAM_POOL_USE_LIFO, false);
        params.values().removeIf(Objects::isNull);
        return params;
    }

    private static Integer toInt(Map<String, ?> values, String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Number n && n.doubleValue() == n.intValue()) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(key, "expected an integer, got '" + s + "'", e);
            }
        }
        throw new ValidationException(key, "expected an integer, got " + value);
    }

    private static boolean toBool(Map<String, ?> values, String key) {
        Object value = values.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) return true;
            if ("false".equalsIgnoreCase(s.trim())) return false;
        }
        throw new ValidationException(key, "expected a boolean, got " + value);
    }

    public String getName() { return name; }
    public DataSourceName getDsn() { return dsn; }
    public boolean isEcho() { return echo; }
    public String getEncoding() { return encoding; }
    public String getTimezone() { return timezone; }
    public boolean isReadonly() { return readonly; }
    public Integer getConnectionTimeout() { return connectionTimeout; }
    public Integer getCommandTimeout() { return commandTimeout; }
    public Integer getPoolMinConnections() { return poolMinConnections; }
    public Integer getPoolMaxConnections() { return poolMaxConnections; }
    public Integer getPoolMaxIdleTime() { return poolMaxIdleTime; }
    public Integer getPoolMaxLifetime() { return poolMaxLifetime; }
    public Integer getPoolRecycleTime() { return poolRecycleTime; }
    public boolean isPoolPrePing() { return poolPrePing; }
    public Integer getPoolMaxOverflow() { return poolMaxOverflow; }
    public boolean isKeepalives() { return keepalives; }
    public Integer getKeepalivesIdle() { return keepalivesIdle; }
    public Integer getKeepalivesInterval() { return keepalivesInterval; }
    public Integer getKeepalivesCount() { return keepalivesCount; }

    // ── DSN pass-through ──────────────────────────────────────

    public String getDriver() { return dsn.getDriver(); }
    public void setDriver(String driver) { dsn.setDriver(driver); }

    public String getUsername() { return dsn.getUsername(); }
    public void setUsername(String username) { dsn.setUsername(username); }

    public String getPassword() { return dsn.getPassword(); }

    /**
     * Sets the DSN password; null or empty clears it.
     */
    public void setPassword(String password) {
        dsn.setPassword(password == null || password.isEmpty() ? null : password);
    }

    public String getHost() { return dsn.getHost(); }
    public void setHost(String host) { dsn.setHost(host); }

    public Integer getPort() { return dsn.getPort(); }
    public void setPort(Integer port) { dsn.setPort(port); }

    /**
     * Database name, or the empty string when the DSN has none.
     */
    public String getDatabase() { return dsn.getDatabase() != null ? dsn.getDatabase() : ""; }
    public void setDatabase(String database) { dsn.setDatabase(database); }

    public Map<String, String> getQuery() { return dsn.getQuery(); }
    public void setQuery(Map<String, String> query) { dsn.setQuery(query); }

    @Override
    public String toString() {
        return "ConnectionSettings{" +
                "name='" + name + '\'' +
                ", dsn='" + dsn.toSafeString() + '\'' +
                ", poolMinConnections=" + poolMinConnections +
                ", poolMaxConnections=" + poolMaxConnections +
                ", poolMaxOverflow=" + poolMaxOverflow +
                ", connectionTimeout=" + connectionTimeout +
                ", commandTimeout=" + commandTimeout +
                ", readonly=" + readonly +
                ", echo=" + echo +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private DataSourceName dsn;

        private boolean echo = false;
        private String encoding = "utf8";
        private String timezone = "UTC";
        private boolean readonly = false;

        private Integer connectionTimeout = 10;
        private Integer commandTimeout = null;

        private Integer poolMinConnections = 5;
        private Integer poolMaxConnections = 10;
        private Integer poolMaxIdleTime = 300;
        private Integer poolMaxLifetime = 3600;
        private Integer poolRecycleTime = 1800;
        private boolean poolPrePing = true;
        private Integer poolMaxOverflow = 10;

        private boolean keepalives = true;
        private Integer keepalivesIdle = 60;
        private Integer keepalivesInterval = 10;
        private Integer keepalivesCount = 5;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * @throws ValidationException if the string is not a valid DSN
         */
        public Builder dsn(String dsn) {
            this.dsn = DataSourceName.parse(dsn);
            return this;
        }

        public Builder dsn(DataSourceName dsn) {
            this.dsn = dsn;
            return this;
        }

        /**
         * Accepts a DSN string or a {@link DataSourceName}; anything else is rejected.
         */
        public Builder dsnValue(Object dsn) {
            if (dsn instanceof String s) {
                return dsn(s);
            }
            if (dsn instanceof DataSourceName d) {
                return dsn(d);
            }
            throw new ValidationException("dsn",
                    "must be a DataSourceName or a string that can be parsed into one, got "
                            + (dsn == null ? "null" : dsn.getClass().getSimpleName()));
        }

        public Builder echo(boolean echo) {
            this.echo = echo;
            return this;
        }

        public Builder encoding(String encoding) {
            this.encoding = encoding;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder readonly(boolean readonly) {
            this.readonly = readonly;
            return this;
        }

        public Builder connectionTimeout(Integer seconds) {
            this.connectionTimeout = seconds;
            return this;
        }

        public Builder commandTimeout(Integer seconds) {
            this.commandTimeout = seconds;
            return this;
        }

        public Builder poolMinConnections(Integer poolMinConnections) {
            this.poolMinConnections = poolMinConnections;
            return this;
        }

        public Builder poolMaxConnections(Integer poolMaxConnections) {
            this.poolMaxConnections = poolMaxConnections;
            return this;
        }

        public Builder poolMaxIdleTime(Integer seconds) {
            this.poolMaxIdleTime = seconds;
            return this;
        }

        public Builder poolMaxLifetime(Integer seconds) {
            this.poolMaxLifetime = seconds;
            return this;
        }

        public Builder poolRecycleTime(Integer seconds) {
            this.poolRecycleTime = seconds;
            return this;
        }

        public Builder poolPrePing(boolean poolPrePing) {
            this.poolPrePing = poolPrePing;
            return this;
        }

        public Builder poolMaxOverflow(Integer poolMaxOverflow) {
            this.poolMaxOverflow = poolMaxOverflow;
            return this;
        }

        public Builder keepalives(boolean keepalives) {
            this.keepalives = keepalives;
            return this;
        }

        public Builder keepalivesIdle(Integer seconds) {
            this.keepalivesIdle = seconds;
            return this;
        }

        public Builder keepalivesInterval(Integer seconds) {
            this.keepalivesInterval = seconds;
            return this;
        }

        public Builder keepalivesCount(Integer keepalivesCount) {
            this.keepalivesCount = keepalivesCount;
            return this;
        }

        /**
         * @throws ValidationException if the name or DSN is missing or a value is out of range
         */
        public ConnectionSettings build() {
            if (name == null || name.isBlank()) {
                throw new ValidationException("name", "must not be null or blank");
            }
            if (dsn == null) {
                throw new ValidationException("dsn", "is required");
            }
            requireNonNegative("pool_min_connections", poolMinConnections);
            requirePositive("pool_max_connections", poolMaxConnections);
            requireNonNegative("pool_max_overflow", poolMaxOverflow);
            requirePositive("pool_max_idle_time", poolMaxIdleTime);
            requirePositive("pool_max_lifetime", poolMaxLifetime);
            requirePositive("pool_recycle_time", poolRecycleTime);
            requirePositive("connection_timeout", connectionTimeout);
            requirePositive("command_timeout", commandTimeout);
            requireNonNegative("keepalives_idle", keepalivesIdle);
            requireNonNegative("keepalives_interval", keepalivesInterval);
            requireNonNegative("keepalives_count", keepalivesCount);
            if (poolMinConnections != null && poolMaxConnections != null
                    && poolMinConnections > poolMaxConnections) {
                throw new ValidationException("pool_min_connections",
                        "cannot exceed pool_max_connections (" + poolMinConnections + " > " + poolMaxConnections + ")");
            }
            return new ConnectionSettings(this);
        }

        private static void requirePositive(String field, Integer value) {
            if (value != null && value <= 0) {
                throw new ValidationException(field, "must be > 0, got " + value);
            }
        }

        private static void requireNonNegative(String field, Integer value) {
            if (value != null && value < 0) {
                throw new ValidationException(field, "must be >= 0, got " + value);
            }
        }
    }
}
