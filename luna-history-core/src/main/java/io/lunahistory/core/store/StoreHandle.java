package io.lunahistory.core.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single SQLite connection. The connection is opened, and the memory schema applied,
 * by the first unit of work rather than at construction, so a client handshake never waits on
 * the file system.
 *
 * <p>All access goes through {@link #withStore(String, StoreWork)}, which holds one lock for the
 * whole unit of work. Nested calls from inside a unit of work are rejected.
 */
public final class StoreHandle implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(StoreHandle.class);

    enum State {
        UNOPENED,
        OPENED,
        CLOSED
    }

    private final Path dbPath;
    private final SchemaManager schemaManager;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private State state = State.UNOPENED;
    private Connection connection;

    public StoreHandle(Path dbPath) {
        this(dbPath, new SchemaManager());
    }

    public StoreHandle(Path dbPath, SchemaManager schemaManager) {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        this.dbPath = dbPath.toAbsolutePath();
        this.schemaManager = schemaManager;
    }

    public Path dbPath() {
        return dbPath;
    }

    /**
     * Runs {@code work} with exclusive use of the connection, opening the store first if needed.
     *
     * @param action short description used in the failure message, e.g. "search memory"
     * @throws StoreSetupException if the store had to be opened and that failed
     * @throws StoreUnavailableException if the lock could not be taken or the handle is closed
     * @throws IOException wrapping the {@link SQLException} raised by {@code work}
     */
    public <T> T withStore(String action, StoreWork<T> work) throws IOException {
        acquire();
        try {
            Connection current = openIfNeeded();
            try {
                return work.run(current);
            } catch (SQLException e) {
                throw new IOException("Failed to " + action + ": " + e.getMessage(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    State state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (connection != null) {
                try {
                    connection.close();
                } catch (SQLException e) {
                    LOG.warn("Failed to close store connection {}: {}", dbPath, e.getMessage());
                }
                connection = null;
            }
            state = State.CLOSED;
        } finally {
            lock.unlock();
        }
    }

    private void acquire() throws StoreUnavailableException {
        if (lock.isHeldByCurrentThread()) {
            throw new StoreUnavailableException("Store is already in use by this unit of work");
        }
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting for the store", e);
        }
    }

    private Connection openIfNeeded() throws IOException {
        if (state == State.OPENED) {
            return connection;
        }
        if (state == State.CLOSED) {
            throw new StoreUnavailableException("Store is closed: " + dbPath);
        }

        Connection opened = open();
        try {
            schemaManager.ensureSchema(opened);
        } catch (StoreSetupException e) {
            closeQuietly(opened);
            LOG.error("Store setup failed for {} at step '{}'", dbPath, e.step(), e);
            throw e;
        }
        connection = opened;
        state = State.OPENED;
        LOG.info("Opened store {}", dbPath);
        return connection;
    }

    private Connection open() throws StoreSetupException {
        Path parent = dbPath.getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StoreSetupException("create store directory " + parent, e);
        }

        Connection opened;
        try {
            opened = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
        } catch (SQLException e) {
            throw new StoreSetupException("open database connection", e);
        }
        try (Statement statement = opened.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        } catch (SQLException e) {
            closeQuietly(opened);
            throw new StoreSetupException("configure database connection", e);
        }
        return opened;
    }

    private void closeQuietly(Connection opened) {
        try {
            opened.close();
        } catch (SQLException e) {
            LOG.debug("Ignoring close failure after setup error: {}", e.getMessage());
        }
    }
}
