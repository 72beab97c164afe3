package com.prrules.analyzer.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;

/**
 * Entry point to the SQLite database. Created once at startup, it applies
 * {@code schema.sql} and hands out {@link StoreSession}s.
 *
 * <h3>Connection strategy</h3>
 * Every session owns its own JDBC connection and must stay on the thread that
 * opened it. The database runs in WAL mode so workers can read while another
 * writes; writers wait on each other through {@code busy_timeout}.
 */
public class StoreHandle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StoreHandle.class);

    static final int BUSY_TIMEOUT_MS = 10_000;

    private final String dbUrl;
    private final Clock clock;
    private volatile boolean closed;

    public StoreHandle(Path databasePath) {
        this(databasePath, Clock.systemUTC());
    }

    // Visible for testing
    StoreHandle(Path databasePath, Clock clock) {
        Path absolute = databasePath.toAbsolutePath();
        try {
            Path parent = absolute.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StoreException("Cannot create database directory for " + absolute, e);
        }
        this.dbUrl = "jdbc:sqlite:" + absolute;
        this.clock = clock;
        initialize();
    }

    Connection getConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(dbUrl);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA busy_timeout = " + BUSY_TIMEOUT_MS);
            stmt.execute("PRAGMA foreign_keys = ON");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    /**
     * Opens a session bound to a fresh connection. The caller owns and closes it.
     */
    public StoreSession openSession() {
        if (closed) {
            throw new IllegalStateException("Store is closed: " + dbUrl);
        }
        try {
            return new StoreSession(getConnection(), clock);
        } catch (SQLException e) {
            throw new StoreException("Cannot open database session on " + dbUrl, e);
        }
    }

    public String url() {
        return dbUrl;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            logger.info("Store closed: {}", dbUrl);
        }
    }

    private void initialize() {
        logger.info("Initializing database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            applySchema(conn);
        } catch (SQLException e) {
            throw new StoreException("Database initialization failed", e);
        }
    }

    /**
     * Runs every statement of {@code schema.sql} in one transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        String schemaSql = SqlLoader.readClasspath("schema.sql");
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty()) {
                    continue;
                }
                stmt.execute(sql.trim());
            }
            conn.commit();
            logger.info("Database schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }
}
