package br.edu.ifba.mindgraph.storage.impl;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import br.edu.ifba.mindgraph.storage.GraphStorageException;
import br.edu.ifba.mindgraph.storage.GraphStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * CDI producer for the SQLite graph store, active when
 * {@code mindgraph.storage.backend=sqlite}.
 *
 * <p>Opens the connection manager, runs schema migrations on startup and closes
 * everything on shutdown.</p>
 *
 * <pre>
 * mindgraph.storage.backend=sqlite
 * mindgraph.storage.sqlite.path=data/mindgraph.db
 * </pre>
 */
@ApplicationScoped
@IfBuildProperty(name = "mindgraph.storage.backend", stringValue = "sqlite", enableIfMissing = true)
public class SQLiteStorageProvider {

    private static final Logger LOG = Logger.getLogger(SQLiteStorageProvider.class);

    @ConfigProperty(name = "mindgraph.storage.sqlite.path", defaultValue = "data/mindgraph.db")
    String databasePath;

    @ConfigProperty(name = "mindgraph.storage.sqlite.read-pool-size", defaultValue = "4")
    int readPoolSize;

    @ConfigProperty(name = "mindgraph.storage.sqlite.busy-timeout", defaultValue = "30000")
    long busyTimeoutMs;

    @ConfigProperty(name = "mindgraph.storage.sqlite.wal-mode", defaultValue = "true")
    boolean walMode;

    private SQLiteConnectionManager connectionManager;
    private SQLiteGraphStore graphStore;

    @PostConstruct
    void initialize() {
        LOG.infof("Initializing SQLite storage with database: %s", databasePath);
        connectionManager = new SQLiteConnectionManager(
            databasePath,
            Duration.ofMillis(busyTimeoutMs),
            walMode,
            readPoolSize
        );

        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to run SQLite schema migrations", e);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
        LOG.info("SQLite storage initialized successfully");
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down SQLite storage");
        if (graphStore != null) {
            graphStore.close();
        }
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Produces
    @ApplicationScoped
    public GraphStore produceGraphStore() {
        if (graphStore == null) {
            graphStore = new SQLiteGraphStore(connectionManager);
            graphStore.initialize().join();
            LOG.info("Created SQLiteGraphStore instance");
        }
        return graphStore;
    }
}
