package com.taskchat.storage;

import com.taskchat.AppLogger;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Connection factory and schema owner for the SQLite database file. Holds no
 * data; every call opens its own connection so any number of workers (or
 * processes) can share the file.
 */
public class SqliteDatabase {

    private static final int BUSY_TIMEOUT_MS = 15_000;

    private static final String[] SCHEMA = {
        "CREATE TABLE IF NOT EXISTS conversations (" +
            " id TEXT PRIMARY KEY," +
            " owner TEXT NOT NULL," +
            " title TEXT NOT NULL," +
            " created_at INTEGER NOT NULL," +
            " updated_at INTEGER NOT NULL)",
        "CREATE INDEX IF NOT EXISTS idx_conversations_owner_updated" +
            " ON conversations(owner, updated_at DESC)",
        "CREATE TABLE IF NOT EXISTS messages (" +
            " id TEXT PRIMARY KEY," +
            " conversation_id TEXT NOT NULL REFERENCES conversations(id) ON DELETE CASCADE," +
            " owner TEXT NOT NULL," +
            " role TEXT NOT NULL CHECK (role IN ('user', 'assistant'))," +
            " content TEXT NOT NULL," +
            " tool_calls TEXT," +
            " seq INTEGER NOT NULL," +
            " created_at INTEGER NOT NULL," +
            " UNIQUE (conversation_id, seq))",
        "CREATE INDEX IF NOT EXISTS idx_messages_conversation_order" +
            " ON messages(conversation_id, created_at, seq)",
        "CREATE TABLE IF NOT EXISTS tasks (" +
            " id TEXT PRIMARY KEY," +
            " owner TEXT NOT NULL," +
            " title TEXT NOT NULL," +
            " description TEXT," +
            " status TEXT NOT NULL CHECK (status IN ('pending', 'completed'))," +
            " priority TEXT NOT NULL CHECK (priority IN ('low', 'medium', 'high'))," +
            " due_date TEXT," +
            " created_at INTEGER NOT NULL," +
            " updated_at INTEGER NOT NULL)",
        "CREATE INDEX IF NOT EXISTS idx_tasks_owner_created" +
            " ON tasks(owner, created_at DESC)"
    };

    private final Path dbPath;
    private final String url;
    private final Properties connectionProperties;

    public SqliteDatabase(Path dbPath) {
        this.dbPath = dbPath.toAbsolutePath().normalize();
        this.url = "jdbc:sqlite:" + this.dbPath;

        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        // Write transactions take the write lock at BEGIN; concurrent writers queue on the busy timeout.
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = config.toProperties();
    }

    public Path getPath() {
        return dbPath;
    }

    public void initializeSchema() {
        try {
            Path parent = dbPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StoreException("Cannot create database directory for " + dbPath, e);
        }
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL");
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot initialize database schema at " + dbPath, e);
        }
        AppLogger.get().info("[SqliteDatabase] Schema ready at " + dbPath);
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(url, connectionProperties);
    }

    /**
     * Runs read-only work on an autocommit connection.
     */
    public <T> T read(SqlWork<T> work) {
        try (Connection connection = openConnection()) {
            return work.run(connection);
        } catch (SQLException e) {
            throw new StoreException("Database read failed", e);
        }
    }

    /**
     * Runs work inside one immediate transaction, committing on success and
     * rolling back on any exception. Store exceptions thrown by the work
     * propagate unchanged after the rollback.
     */
    public <T> T write(SqlWork<T> work) {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                T result = work.run(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Database write failed", e);
        }
    }

    private void rollbackQuietly(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }
}
