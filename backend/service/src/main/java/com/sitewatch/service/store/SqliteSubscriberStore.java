package com.sitewatch.service.store;

import com.sitewatch.monitor.api.CapacityExceededException;
import com.sitewatch.monitor.api.StorageException;
import com.sitewatch.monitor.api.StorageInitException;
import com.sitewatch.monitor.api.SubscriberStore;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/**
 * SQLite-backed subscriber store. Every call opens its own connection and runs exactly one transaction,
 * so no connection or lock outlives an operation. Unsubscribing clears the flag and keeps the row.
 */
public class SqliteSubscriberStore implements SubscriberStore {
    private static final Logger LOGGER = Logger.getLogger(SqliteSubscriberStore.class.getName());

    private static final String CREATE_STATEMENT = """
            CREATE TABLE IF NOT EXISTS subscribers (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                user_id INTEGER UNIQUE NOT NULL,
                is_subscribed BOOLEAN NOT NULL DEFAULT 1
            )
            """;
    private static final String COUNT_STATEMENT = "SELECT COUNT(*) FROM subscribers";
    private static final String SUBSCRIBED_STATEMENT = "SELECT user_id FROM subscribers WHERE is_subscribed = 1";
    private static final String STATUS_STATEMENT = "SELECT is_subscribed FROM subscribers WHERE user_id = ?";
    private static final String INSERT_STATEMENT = "INSERT INTO subscribers (user_id, is_subscribed) VALUES (?, 1)";
    private static final String SET_FLAG_STATEMENT = "UPDATE subscribers SET is_subscribed = ? WHERE user_id = ?";

    private final Path databasePath;
    private final long maxSubscribers;
    private final Properties readProperties;
    private final Properties writeProperties;

    public SqliteSubscriberStore(Path databasePath, long maxSubscribers) {
        if (maxSubscribers < 1) {
            throw new IllegalArgumentException("maxSubscribers must be at least 1");
        }
        this.databasePath = databasePath;
        this.maxSubscribers = maxSubscribers;
        this.readProperties = sqliteConfig(SQLiteConfig.TransactionMode.DEFERRED).toProperties();
        this.writeProperties = sqliteConfig(SQLiteConfig.TransactionMode.IMMEDIATE).toProperties();
    }

    @Override
    public void ensureInitialized() {
        try {
            Path parent = databasePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            inTransaction(true, connection -> {
                try (Statement statement = connection.createStatement()) {
                    statement.execute(CREATE_STATEMENT);
                }
                return null;
            });
        } catch (IOException | StorageException e) {
            throw new StorageInitException("Failed initializing subscriber database at " + databasePath, e);
        }
        LOGGER.info("Successfully initialized database at " + databasePath);
    }

    @Override
    public long count() {
        return inTransaction(false, connection -> {
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery(COUNT_STATEMENT)) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    @Override
    public Set<Long> listSubscribed() {
        return inTransaction(false, connection -> {
            Set<Long> ids = new HashSet<>();
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery(SUBSCRIBED_STATEMENT)) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
            return Set.copyOf(ids);
        });
    }

    @Override
    public boolean subscribe(long userId) {
        return inTransaction(true, connection -> {
            Boolean subscribed = subscriptionFlag(connection, userId);
            if (Boolean.TRUE.equals(subscribed)) {
                return false;
            }
            if (subscribed == null) {
                long total;
                try (Statement statement = connection.createStatement();
                     ResultSet rs = statement.executeQuery(COUNT_STATEMENT)) {
                    total = rs.next() ? rs.getLong(1) : 0L;
                }
                if (total >= maxSubscribers) {
                    throw new CapacityExceededException(maxSubscribers);
                }
                try (PreparedStatement insert = connection.prepareStatement(INSERT_STATEMENT)) {
                    insert.setLong(1, userId);
                    insert.executeUpdate();
                }
            } else {
                setFlag(connection, userId, true);
            }
            LOGGER.info("Added subscriber " + userId);
            return true;
        });
    }

    @Override
    public boolean unsubscribe(long userId) {
        return inTransaction(true, connection -> {
            if (!Boolean.TRUE.equals(subscriptionFlag(connection, userId))) {
                return false;
            }
            setFlag(connection, userId, false);
            LOGGER.info("Removed subscriber " + userId);
            return true;
        });
    }

    @Override
    public boolean isSubscribed(long userId) {
        return inTransaction(false, connection -> Boolean.TRUE.equals(subscriptionFlag(connection, userId)));
    }

    public Path databasePath() {
        return databasePath;
    }

    public long maxSubscribers() {
        return maxSubscribers;
    }

    /**
     * @return the stored flag, or null when the user has no row
     */
    private static Boolean subscriptionFlag(Connection connection, long userId) throws SQLException {
        try (PreparedStatement query = connection.prepareStatement(STATUS_STATEMENT)) {
            query.setLong(1, userId);
            try (ResultSet rs = query.executeQuery()) {
                return rs.next() ? rs.getBoolean(1) : null;
            }
        }
    }

    private static void setFlag(Connection connection, long userId, boolean subscribed) throws SQLException {
        try (PreparedStatement update = connection.prepareStatement(SET_FLAG_STATEMENT)) {
            update.setBoolean(1, subscribed);
            update.setLong(2, userId);
            update.executeUpdate();
        }
    }

    private <T> T inTransaction(boolean write, SqlWork<T> work) {
        String url = "jdbc:sqlite:" + databasePath.toAbsolutePath();
        try (Connection connection = DriverManager.getConnection(url, write ? writeProperties : readProperties)) {
            connection.setAutoCommit(false);
            try {
                T result = work.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Subscriber storage failure at " + databasePath + ": " + e.getMessage(), e);
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    private static SQLiteConfig sqliteConfig(SQLiteConfig.TransactionMode mode) {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(5000);
        config.setSynchronous(SQLiteConfig.SynchronousMode.FULL);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setTransactionMode(mode);
        return config;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }
}
