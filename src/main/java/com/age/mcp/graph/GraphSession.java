package com.age.mcp.graph;

import com.age.mcp.agtype.RecordDecoder;
import com.age.mcp.core.model.GraphRecord;
import com.age.mcp.metrics.MetricsService;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * One transactional unit of work on a pooled connection.
 *
 * <p>Sessions are opened by {@link SessionFactory} with auto-commit off and are not
 * thread-safe. Closing a session returns its connection to the pool; uncommitted work is
 * discarded by the pool.</p>
 *
 * <p>Apache AGE queries go through {@link #cypher(String, String, String...)}, which wraps
 * the Cypher text in an {@code ag_catalog.cypher(...)} call and decodes the agtype result:</p>
 * <pre>{@code
 * List<GraphRecord> people = session.cypher("social", "MATCH (p:Person) RETURN p", "p");
 * }</pre>
 */
public class GraphSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GraphSession.class);

    static final String DEFAULT_COLUMN = "result";
    static final String LOAD_AGE = "LOAD 'age'";
    static final String SET_SEARCH_PATH = "SET search_path = ag_catalog, \"$user\", public";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String DOLLAR_QUOTE = "$$";

    private final Connection connection;
    private final ConnectionSettings settings;
    private final MetricsService metrics;
    private boolean ageLoaded;

    GraphSession(Connection connection, ConnectionSettings settings, MetricsService metrics) {
        this.connection = connection;
        this.settings = settings;
        this.metrics = metrics;
    }

    /**
     * Runs a query and returns its rows as ordered column-to-value maps.
     * PostgreSQL extension types such as {@code agtype} are returned as their text form.
     */
    public List<Map<String, Object>> query(String sql, Object... params) throws SQLException {
        logStatement(sql);
        try (PreparedStatement ps = prepare(sql, params);
             ResultSet rs = ps.executeQuery()) {
            return readRows(rs);
        }
    }

    /**
     * Runs a statement that returns no rows.
     *
     * @return the update count
     */
    public int execute(String sql, Object... params) throws SQLException {
        logStatement(sql);
        try (PreparedStatement ps = prepare(sql, params)) {
            return ps.executeUpdate();
        }
    }

    /**
     * Runs a Cypher query against an AGE graph and decodes every vertex and edge
     * in the result.
     *
     * @param graphName AGE graph name
     * @param cypher    Cypher text, must not contain {@code $$}
     * @param columns   result column names; defaults to a single {@code result} column
     * @throws IllegalArgumentException if the graph or a column name is not a plain identifier
     * @throws com.age.mcp.agtype.DecodeException         if AGE returned malformed agtype
     * @throws com.age.mcp.core.model.SchemaMismatchException if a value is not a vertex or edge
     */
    public List<GraphRecord> cypher(String graphName, String cypher, String... columns) throws SQLException {
        List<Map<String, Object>> rows = cypherQuery(graphName, cypher, columns);
        metrics.recordDecodeBatchSize(rows.size());
        return GraphRecord.fromDecodedRows(rows);
    }

    /**
     * Like {@link #cypher(String, String, String...)} but keeps the row shape: vertex and
     * edge columns are decoded in place, other columns keep their agtype text.
     */
    public List<Map<String, Object>> cypherRows(String graphName, String cypher, String... columns)
            throws SQLException {
        List<Map<String, Object>> rows = cypherQuery(graphName, cypher, columns);
        List<Map<String, Object>> decoded = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            decoded.add(RecordDecoder.decodeRow(row));
        }
        return decoded;
    }

    private List<Map<String, Object>> cypherQuery(String graphName, String cypher, String... columns)
            throws SQLException {
        String sql = buildCypherSql(graphName, cypher, columns);
        ensureAgeLoaded();
        logStatement(sql);
        try (Statement stmt = connection.createStatement()) {
            applyCommandTimeout(stmt);
            try (ResultSet rs = stmt.executeQuery(sql)) {
                return readRows(rs);
            }
        }
    }

    static String buildCypherSql(String graphName, String cypher, String... columns) {
        requireIdentifier("graph name", graphName);
        if (cypher == null || cypher.isBlank()) {
            throw new IllegalArgumentException("cypher must not be blank");
        }
        if (cypher.contains(DOLLAR_QUOTE)) {
            throw new IllegalArgumentException("cypher must not contain " + DOLLAR_QUOTE);
        }
        StringJoiner signature = new StringJoiner(", ");
        if (columns == null || columns.length == 0) {
            signature.add(DEFAULT_COLUMN + " agtype");
        } else {
            for (String column : columns) {
                requireIdentifier("column", column);
                signature.add(column + " agtype");
            }
        }
        return "SELECT * FROM ag_catalog.cypher('" + graphName + "', $$ " + cypher + " $$) AS (" + signature + ")";
    }

    private static void requireIdentifier(String what, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + value + "'");
        }
    }

    private void ensureAgeLoaded() throws SQLException {
        if (ageLoaded) {
            return;
        }
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(LOAD_AGE);
            stmt.execute(SET_SEARCH_PATH);
        }
        ageLoaded = true;
    }

    private PreparedStatement prepare(String sql, Object... params) throws SQLException {
        PreparedStatement ps = connection.prepareStatement(sql);
        try {
            applyCommandTimeout(ps);
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
        return ps;
    }

    private void applyCommandTimeout(Statement stmt) throws SQLException {
        if (settings.getCommandTimeout() != null) {
            stmt.setQueryTimeout(settings.getCommandTimeout());
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                Object value = rs.getObject(i);
                if (value instanceof PGobject pg) {
                    value = pg.getValue();
                }
                row.put(meta.getColumnLabel(i), value);
            }
            rows.add(row);
        }
        return rows;
    }

    private void logStatement(String sql) {
        if (settings.isEcho()) {
            log.info("sql.statement connection={} sql={}", settings.getName(), sql);
        } else {
            log.debug("sql.statement connection={} sql={}", settings.getName(), sql);
        }
    }

    public void commit() throws SQLException {
        connection.commit();
    }

    public void rollback() throws SQLException {
        connection.rollback();
    }

    /**
     * The underlying pooled connection, for JDBC calls this class does not cover.
     */
    public Connection getConnection() {
        return connection;
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
