package br.edu.ifba.mindgraph.storage.impl;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

import br.edu.ifba.mindgraph.storage.GraphStorageException;

/**
 * Manages SQLite connections for the graph store.
 *
 * <ul>
 *   <li>WAL mode, so readers see committed rows and never wait on the writer</li>
 *   <li>Pool of read connections</li>
 *   <li>Single write connection guarded by a {@link ReentrantLock}</li>
 *   <li>Foreign keys enforced, which is what makes deletes cascade</li>
 * </ul>
 *
 * <pre>
 * SQLiteConnectionManager manager = new SQLiteConnectionManager("data/mindgraph.db");
 * Connection conn = manager.getWriteConnection();
 * try {
 *     // write
 * } finally {
 *     manager.releaseWriteConnection(conn);
 * }
 * </pre>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final boolean DEFAULT_WAL_MODE = true;
    private static final int DEFAULT_POOL_SIZE = 4;
    private static final int DEFAULT_CACHE_SIZE = -2000; // 2MB

    private final String databasePath;
    private final Duration busyTimeout;
    private final boolean walMode;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock;

    private Connection writeConnection;
    private volatile boolean closed = false;

    /**
     * Creates a connection manager with default settings.
     *
     * @param databasePath path to the SQLite database file
     */
    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, DEFAULT_WAL_MODE, DEFAULT_POOL_SIZE);
    }

    /**
     * @param databasePath path to the SQLite database file
     * @param busyTimeout how long SQLite waits for a lock before failing
     * @param walMode whether to enable WAL journaling
     * @param readPoolSize number of pooled read connections
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, boolean walMode, int readPoolSize) {
        if (databasePath == null || databasePath.isBlank()) {
            throw new IllegalArgumentException("databasePath must not be blank");
        }
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.walMode = walMode;
        this.readPool = new ArrayBlockingQueue<>(Math.max(1, readPoolSize));
        this.writeLock = new ReentrantLock();
    }

    /**
     * Creates a new configured connection. Parent directories are created on demand.
     */
    public Connection createConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
        ensureParentDirectory();
        try {
            SQLiteConfig config = new SQLiteConfig();
            config.enforceForeignKeys(true);
            config.setBusyTimeout((int) busyTimeout.toMillis());
            config.setCacheSize(DEFAULT_CACHE_SIZE);

            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
            applyPragmas(conn);
            LOG.debugf("Created SQLite connection to %s", databasePath);
            return conn;
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to create SQLite connection to " + databasePath, e);
        }
    }

    private void ensureParentDirectory() {
        if (databasePath.startsWith(":memory:")) {
            return;
        }
        try {
            Path parentDir = Paths.get(databasePath).toAbsolutePath().getParent();
            if (parentDir != null && !Files.exists(parentDir)) {
                Files.createDirectories(parentDir);
                LOG.infof("Created database directory: %s", parentDir);
            }
        } catch (Exception e) {
            LOG.warnf("Could not create parent directory for %s: %s", databasePath, e.getMessage());
        }
    }

    /**
     * Takes a read connection from the pool, or opens one when the pool is empty.
     */
    public Connection getReadConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
        Connection conn = readPool.poll();
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debug("Read connection was closed, creating new one", e);
            }
        }
        return createConnection();
    }

    /**
     * Returns a read connection to the pool, closing it when the pool is full.
     */
    public void releaseReadConnection(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            if (!conn.isClosed() && !closed) {
                if (!readPool.offer(conn)) {
                    conn.close();
                }
            } else {
                conn.close();
            }
        } catch (SQLException e) {
            LOG.debug("Error releasing read connection", e);
        }
    }

    /**
     * Gets the exclusive write connection. The caller holds the write lock until
     * {@link #releaseWriteConnection(Connection)}.
     */
    public Connection getWriteConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
        writeLock.lock();
        try {
            if (writeConnection == null || writeConnection.isClosed()) {
                writeConnection = createConnection();
            }
            return writeConnection;
        } catch (SQLException | RuntimeException e) {
            writeLock.unlock();
            throw new GraphStorageException("Failed to get write connection", e);
        }
    }

    public void releaseWriteConnection(Connection conn) {
        if (conn == writeConnection && writeLock.isHeldByCurrentThread()) {
            writeLock.unlock();
        }
    }

    private void applyPragmas(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (walMode) {
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            stmt.execute("PRAGMA synchronous = NORMAL");
            stmt.execute("PRAGMA temp_store = MEMORY");
        }
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public Duration getBusyTimeout() {
        return busyTimeout;
    }

    public boolean isWalModeEnabled() {
        return walMode;
    }

    @Override
    public void close() {
        closed = true;
        writeLock.lock();
        try {
            if (writeConnection != null) {
                try {
                    writeConnection.close();
                } catch (SQLException e) {
                    LOG.debug("Error closing write connection", e);
                }
                writeConnection = null;
            }
        } finally {
            writeLock.unlock();
        }
        Connection conn;
        while ((conn = readPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.debug("Error closing pooled connection", e);
            }
        }
        LOG.infof("Closed SQLite connection manager for %s", databasePath);
    }
}
