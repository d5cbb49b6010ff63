package br.edu.ifba.mindgraph.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for SQLiteSchemaMigrator.
 *
 * Tests verify:
 * 1. Version tracking starts at 0 and records applied migrations
 * 2. The migrations create the graph and vocabulary tables
 * 3. Re-running is a no-op
 * 4. A failing migration leaves no partial schema
 */
class SQLiteSchemaMigratorTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteSchemaMigrator migrator;

    @BeforeEach
    void setUp() {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("test.db").toString());
        migrator = new SQLiteSchemaMigrator();
    }

    @AfterEach
    void tearDown() {
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Test
    void testGetCurrentVersionReturnsZeroForNewDatabase() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            assertEquals(0, migrator.getCurrentVersion(conn), "New database should have version 0");
        }
    }

    @Test
    void testMigrateToLatestCreatesGraphTables() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            migrator.migrateToLatest(conn);

            for (String table : List.of("schema_version", "profiles", "graph_nodes", "graph_edges", "extraction_logs",
                    "relationship_types")) {
                try (Statement stmt = conn.createStatement();
                     ResultSet rs = stmt.executeQuery(
                         "SELECT name FROM sqlite_master WHERE type='table' AND name='" + table + "'")) {
                    assertTrue(rs.next(), table + " table should exist");
                }
            }
            assertEquals(2, migrator.getCurrentVersion(conn));
        }
    }

    @Test
    void testMigrateToLatestIsIdempotent() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            migrator.migrateToLatest(conn);
            migrator.migrateToLatest(conn);

            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM schema_version")) {
                assertTrue(rs.next());
                assertEquals(2, rs.getInt(1), "Each migration is recorded once");
            }
        }
    }

    @Test
    void testFailedMigrationRollsBack() throws Exception {
        SQLiteSchemaMigrator.Migration broken = new SQLiteSchemaMigrator.Migration() {
            @Override
            public int getVersion() {
                return 3;
            }

            @Override
            public String getDescription() {
                return "Broken migration";
            }

            @Override
            public void apply(Connection conn) throws SQLException {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("CREATE TABLE half_done (id TEXT)");
                    stmt.execute("THIS IS NOT SQL");
                }
            }
        };
        SQLiteSchemaMigrator failing = new SQLiteSchemaMigrator(
            List.of(migrator.getMigrations().get(0), migrator.getMigrations().get(1), broken));

        try (Connection conn = connectionManager.createConnection()) {
            assertThrows(SQLException.class, () -> failing.migrateToLatest(conn));

            assertEquals(0, migrator.getCurrentVersion(conn));
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(
                     "SELECT name FROM sqlite_master WHERE type='table' AND name='half_done'")) {
                assertFalse(rs.next(), "Partial schema should be rolled back");
            }
        }
    }

    @Test
    void testSplitStatementsIgnoresCommentsAndQuotedSemicolons() {
        List<String> statements = SQLiteSchemaMigrator.splitStatements("""
            -- header comment
            CREATE TABLE a (v TEXT DEFAULT 'x;y'); -- trailing
            INSERT INTO a VALUES ('--not a comment');
            """);

        assertEquals(2, statements.size());
        assertEquals("CREATE TABLE a (v TEXT DEFAULT 'x;y')", statements.get(0));
        assertEquals("INSERT INTO a VALUES ('--not a comment')", statements.get(1));
    }
}
