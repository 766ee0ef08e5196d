package com.age.mcp.graph;

import com.age.mcp.core.model.GraphRecord;
import com.age.mcp.core.model.RecordKind;
import com.age.mcp.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.postgresql.util.PGobject;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GraphSessionTest {

    private static final String CITY = "{\"id\": 844424930131969, \"label\": \"City\", \"properties\": {\"name\": \"NYC\"}}::vertex";

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Mock
    private ResultSet resultSet;

    @Mock
    private ResultSetMetaData metaData;

    @Mock
    private MetricsService metrics;

    private ConnectionSettings settings;
    private GraphSession session;

    @BeforeEach
    void setUp() {
        settings = ConnectionSettings.builder()
                .name("main")
                .dsn("postgresql://age@localhost/graphs")
                .commandTimeout(30)
                .build();
        session = new GraphSession(connection, settings, metrics);
    }

    private static PGobject agtype(String value) throws SQLException {
        PGobject pg = new PGobject();
        pg.setType("agtype");
        pg.setValue(value);
        return pg;
    }

    private void stubSingleColumn(String column, Object... values) throws SQLException {
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(1);
        lenient().when(metaData.getColumnLabel(1)).thenReturn(column);
        Boolean[] more = new Boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            more[i] = i < values.length - 1;
        }
        if (values.length == 0) {
            when(resultSet.next()).thenReturn(false);
        } else {
            when(resultSet.next()).thenReturn(true, more);
            Object[] rest = new Object[values.length - 1];
            System.arraycopy(values, 1, rest, 0, rest.length);
            when(resultSet.getObject(1)).thenReturn(values[0], rest);
        }
    }

    @Nested
    @DisplayName("Cypher SQL building")
    class BuildSqlTests {

        @Test
        @DisplayName("Should wrap cypher in an ag_catalog call with typed columns")
        void testBuild() {
            assertEquals("SELECT * FROM ag_catalog.cypher('social', $$ MATCH (a)-[r]->(b) RETURN a, r $$) AS (a agtype, r agtype)",
                    GraphSession.buildCypherSql("social", "MATCH (a)-[r]->(b) RETURN a, r", "a", "r"));
        }

        @Test
        @DisplayName("Should default to a single result column")
        void testDefaultColumn() {
            assertTrue(GraphSession.buildCypherSql("g", "RETURN 1").endsWith("AS (result agtype)"));
        }

        @Test
        @DisplayName("Should reject unsafe graph and column names")
        void testRejectIdentifiers() {
            assertThrows(IllegalArgumentException.class, () -> GraphSession.buildCypherSql("g'; DROP", "RETURN 1"));
            assertThrows(IllegalArgumentException.class, () -> GraphSession.buildCypherSql("g", "RETURN 1", "1col"));
            assertThrows(IllegalArgumentException.class, () -> GraphSession.buildCypherSql(null, "RETURN 1"));
        }

        @Test
        @DisplayName("Should reject cypher that could close the dollar quote")
        void testRejectDollarQuote() {
            assertThrows(IllegalArgumentException.class,
                    () -> GraphSession.buildCypherSql("g", "RETURN 1 $$; DROP TABLE x; $$"));
            assertThrows(IllegalArgumentException.class, () -> GraphSession.buildCypherSql("g", " "));
        }
    }

    @Nested
    @DisplayName("Query execution")
    class ExecutionTests {

        @Test
        @DisplayName("cypher should load AGE once and decode records")
        void testCypher() throws SQLException {
            when(connection.createStatement()).thenReturn(statement);
            when(statement.executeQuery(anyString())).thenReturn(resultSet);
            stubSingleColumn("c", agtype(CITY));

            List<GraphRecord> records = session.cypher("geo", "MATCH (c:City) RETURN c", "c");

            assertEquals(1, records.size());
            assertEquals("City", records.get(0).getLabel());
            assertEquals(RecordKind.VERTEX, records.get(0).kind());
            assertEquals(Map.of("name", "NYC"), records.get(0).getProperties());
            verify(statement).execute(GraphSession.LOAD_AGE);
            verify(statement).execute(GraphSession.SET_SEARCH_PATH);
            verify(statement).setQueryTimeout(30);
            verify(metrics).recordDecodeBatchSize(1);
        }

        @Test
        @DisplayName("Second cypher call should not reload AGE")
        void testAgeLoadedOnce() throws SQLException {
            when(connection.createStatement()).thenReturn(statement);
            when(statement.executeQuery(anyString())).thenReturn(resultSet);
            when(resultSet.getMetaData()).thenReturn(metaData);
            when(metaData.getColumnCount()).thenReturn(1);
            when(resultSet.next()).thenReturn(false);

            session.cypher("geo", "MATCH (c) RETURN c");
            session.cypher("geo", "MATCH (c) RETURN c");

            verify(statement, times(1)).execute(GraphSession.LOAD_AGE);
        }

        @Test
        @DisplayName("cypherRows should decode agtype values in place")
        void testCypherRows() throws SQLException {
            when(connection.createStatement()).thenReturn(statement);
            when(statement.executeQuery(anyString())).thenReturn(resultSet);
            stubSingleColumn("c", agtype(CITY));

            List<Map<String, Object>> rows = session.cypherRows("geo", "MATCH (c:City) RETURN c", "c");

            assertEquals(1, rows.size());
            Map<?, ?> city = assertInstanceOf(Map.class, rows.get(0).get("c"));
            assertEquals("City", city.get("label"));
        }

        @Test
        @DisplayName("query should bind parameters and return ordered rows")
        void testQuery() throws SQLException {
            PreparedStatement ps = mock(PreparedStatement.class);
            when(connection.prepareStatement("SELECT name FROM ag_catalog.ag_graph WHERE name = ?")).thenReturn(ps);
            when(ps.executeQuery()).thenReturn(resultSet);
            stubSingleColumn("name", "geo");

            List<Map<String, Object>> rows = session.query("SELECT name FROM ag_catalog.ag_graph WHERE name = ?", "geo");

            assertEquals(List.of(Map.of("name", "geo")), rows);
            verify(ps).setObject(1, "geo");
            verify(ps).setQueryTimeout(30);
            verify(ps).close();
        }

        @Test
        @DisplayName("execute should return the update count")
        void testExecute() throws SQLException {
            PreparedStatement ps = mock(PreparedStatement.class);
            when(connection.prepareStatement(anyString())).thenReturn(ps);
            when(ps.executeUpdate()).thenReturn(2);

            assertEquals(2, session.execute("DELETE FROM t WHERE a = ? AND b = ?", 1, "x"));
            verify(ps).setObject(1, 1);
            verify(ps).setObject(2, "x");
        }

        @Test
        @DisplayName("commit, rollback and close should delegate to the connection")
        void testDelegation() throws SQLException {
            session.commit();
            session.rollback();
            session.close();

            verify(connection).commit();
            verify(connection).rollback();
            verify(connection).close();
            assertSame(connection, session.getConnection());
        }
    }
}
