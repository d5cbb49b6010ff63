package br.edu.ifba.mindgraph.storage.impl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Applies the classpath SQL migrations under {@code /db/migrations/} in version order.
 *
 * <p>Files are named {@code V{version}__{description}.sql}. The applied version is
 * recorded in {@code schema_version} by the migrator, not by the scripts.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this(List.of(
            new ResourceMigration(1, "Initial knowledge graph schema", MIGRATION_PATH + "V001__initial_schema.sql"),
            new ResourceMigration(2, "Runtime relationship types", MIGRATION_PATH + "V002__relationship_types.sql")
        ));
    }

    SQLiteSchemaMigrator(List<Migration> migrations) {
        this.migrations = migrations.stream()
            .sorted((a, b) -> Integer.compare(a.getVersion(), b.getVersion()))
            .toList();
    }

    /**
     * Reads the current schema version, 0 when the database is empty.
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type='table' AND name='schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            if (rs.next()) {
                int version = rs.getInt(1);
                return rs.wasNull() ? 0 : version;
            }
        }
        return 0;
    }

    /**
     * Applies all pending migrations in one transaction.
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.infof("Current schema version: %d", currentVersion);

        boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);
            for (Migration migration : migrations) {
                if (migration.getVersion() > currentVersion) {
                    LOG.infof("Applying migration V%d: %s", migration.getVersion(), migration.getDescription());
                    migration.apply(conn);
                    recordVersion(conn, migration);
                }
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private void recordVersion(Connection conn, Migration migration) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO schema_version (version, description, applied_at) VALUES (?, ?, ?)")) {
            stmt.setInt(1, migration.getVersion());
            stmt.setString(2, migration.getDescription());
            stmt.setLong(3, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    public List<Migration> getMigrations() {
        return new ArrayList<>(migrations);
    }

    /**
     * One schema migration step.
     */
    public interface Migration {
        int getVersion();

        String getDescription();

        void apply(Connection conn) throws SQLException;
    }

    /**
     * Migration whose SQL is a classpath resource.
     */
    static final class ResourceMigration implements Migration {
        private final int version;
        private final String description;
        private final String resourcePath;

        ResourceMigration(int version, String description, String resourcePath) {
            this.version = version;
            this.description = description;
            this.resourcePath = resourcePath;
        }

        @Override
        public int getVersion() {
            return version;
        }

        @Override
        public String getDescription() {
            return description;
        }

        @Override
        public void apply(Connection conn) throws SQLException {
            try (Statement stmt = conn.createStatement()) {
                for (String statement : splitStatements(loadResource())) {
                    LOG.tracef("Executing: %s", statement.substring(0, Math.min(60, statement.length())));
                    stmt.execute(statement);
                }
            }
        }

        private String loadResource() {
            InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath);
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load migration: " + resourcePath, e);
            }
        }
    }

    /**
     * Splits a script into statements: drops {@code --} comments and splits on
     * semicolons outside quoted strings.
     */
    static List<String> splitStatements(String sql) {
        StringBuilder cleaned = new StringBuilder();
        for (String line : sql.split("\n")) {
            int commentIndex = findCommentStart(line);
            String code = commentIndex >= 0 ? line.substring(0, commentIndex) : line;
            if (!code.isBlank()) {
                cleaned.append(code).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        char quoteChar = 0;
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (inQuote) {
                current.append(c);
                if (c == quoteChar) {
                    inQuote = false;
                }
            } else if (c == '\'' || c == '"') {
                current.append(c);
                inQuote = true;
                quoteChar = c;
            } else if (c == ';') {
                addIfPresent(statements, current);
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }
        addIfPresent(statements, current);
        return statements;
    }

    private static void addIfPresent(List<String> statements, StringBuilder current) {
        String stmt = current.toString().trim();
        if (!stmt.isEmpty()) {
            statements.add(stmt);
        }
    }

    private static int findCommentStart(String line) {
        boolean inQuote = false;
        char quoteChar = 0;
        for (int i = 0; i < line.length() - 1; i++) {
            char c = line.charAt(i);
            if (inQuote) {
                if (c == quoteChar) {
                    inQuote = false;
                }
            } else if (c == '\'' || c == '"') {
                inQuote = true;
                quoteChar = c;
            } else if (c == '-' && line.charAt(i + 1) == '-') {
                return i;
            }
        }
        return -1;
    }
}
