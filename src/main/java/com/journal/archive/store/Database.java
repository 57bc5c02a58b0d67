package com.journal.archive.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;

/**
 * SQLite-backed relational store.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per unit of work and per read, and closed
 * right after. SQLite serializes writers at the file level, so pooling buys nothing.
 *
 * <h3>Transactions</h3>
 * Write transactions start with {@code BEGIN IMMEDIATE}: the database write lock is
 * taken up front and held until commit or rollback. Any lock the engine takes
 * inside a write transaction is therefore ordered after the database lock.
 * Readers use auto-commit connections and, with WAL enabled, never wait for a writer.
 *
 * <p>The schema is applied from {@code schema.sql} on construction. Every DDL
 * statement is {@code IF NOT EXISTS}, so re-applying is harmless.</p>
 */
public class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final StoreConfig config;
    private final Clock clock;
    private final JsonCodec json;

    public Database(StoreConfig config) {
        this(config, Clock.systemUTC(), new JsonCodec());
    }

    public Database(StoreConfig config, Clock clock, JsonCodec json) {
        this.config = config;
        this.clock = clock;
        this.json = json;
        initialize();
    }

    /**
     * Opens a new connection with foreign keys, busy timeout and the immediate
     * transaction mode applied.
     */
    Connection openConnection() throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setBusyTimeout(config.busyTimeoutMs());
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        if (config.walEnabled()) {
            sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
            sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        }
        return DriverManager.getConnection(config.jdbcUrl(), sqlite.toProperties());
    }

    /**
     * Starts a write transaction. The caller must close the returned unit of work;
     * closing without {@link UnitOfWork#commit()} rolls back.
     */
    public UnitOfWork begin() {
        Connection conn = null;
        try {
            conn = openConnection();
            conn.setAutoCommit(false);
            return new UnitOfWork(conn, clock.instant(), json);
        } catch (SQLException e) {
            closeQuietly(conn);
            throw new ArchiveStoreException("Failed to begin transaction on " + config.jdbcUrl(), e);
        }
    }

    /**
     * Runs a read against an auto-commit connection.
     */
    public <T> T read(SqlFunction<Connection, T> query) {
        try (Connection conn = openConnection()) {
            return query.apply(conn);
        } catch (SQLException e) {
            throw new ArchiveStoreException("Read failed: " + e.getMessage(), e);
        }
    }

    public Clock clock() {
        return clock;
    }

    public JsonCodec json() {
        return json;
    }

    public StoreConfig config() {
        return config;
    }

    private void initialize() {
        log.info("store.initializing url={}", config.jdbcUrl());
        try (Connection conn = openConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new ArchiveStoreException("Database initialization failed", e);
        }
    }

    private void applySchema(Connection conn) throws SQLException {
        String schemaSql;
        try (InputStream schemaStream = Database.class.getClassLoader().getResourceAsStream("schema.sql")) {
            if (schemaStream == null) {
                throw new ArchiveStoreException("schema.sql not found on the classpath");
            }
            schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArchiveStoreException("Failed to read schema.sql", e);
        }

        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (!sql.isBlank()) {
                    stmt.execute(sql.trim());
                }
            }
            conn.commit();
            log.info("store.schemaApplied");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    private static void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("store.closeFailed error={}", e.getMessage());
        }
    }

    /**
     * A function over a JDBC resource that may throw {@link SQLException}.
     */
    @FunctionalInterface
    public interface SqlFunction<I, O> {
        O apply(I input) throws SQLException;
    }
}
