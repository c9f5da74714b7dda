package io.contextrunr.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed record store.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code records}: key, JSON document, last update time</li>
 * </ul>
 */
public class SQLiteRecordStore implements RecordStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SQLiteRecordStore.class);

    private final String dbPath;
    private Connection connection;

    public SQLiteRecordStore(String dbPath) {
        this.dbPath = dbPath;
    }

    public synchronized void init() {
        try {
            Path parent = Path.of(dbPath).toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
                stmt.execute("""
                    CREATE TABLE IF NOT EXISTS records (
                        key TEXT PRIMARY KEY,
                        value TEXT NOT NULL,
                        updated_at TEXT NOT NULL
                    )
                    """);
            }
            log.info("SQLiteRecordStore initialized at: {}", dbPath);
        } catch (SQLException | IOException e) {
            log.error("Failed to initialize SQLite record store at {}", dbPath, e);
            throw new StorageException("Record store initialization failed", e);
        }
    }

    @Override
    public synchronized Optional<String> get(String key) {
        try (var stmt = connection.prepareStatement("SELECT value FROM records WHERE key = ?")) {
            stmt.setString(1, key);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString(1));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StorageException("Failed to read record: " + key, e);
        }
    }

    @Override
    public synchronized void set(String key, String value) {
        String sql = """
            INSERT INTO records (key, value, updated_at) VALUES (?, ?, ?)
            ON CONFLICT(key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, key);
            stmt.setString(2, value);
            stmt.setString(3, Timestamps.format(Instant.now()));
            stmt.executeUpdate();
            log.debug("Stored record: {}", key);
        } catch (SQLException e) {
            throw new StorageException("Failed to write record: " + key, e);
        }
    }

    @Override
    public synchronized boolean delete(String key) {
        try (var stmt = connection.prepareStatement("DELETE FROM records WHERE key = ?")) {
            stmt.setString(1, key);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete record: " + key, e);
        }
    }

    @Override
    public synchronized List<String> scan(String prefix) {
        List<String> keys = new ArrayList<>();
        try (var stmt = connection.prepareStatement(
                "SELECT key FROM records WHERE substr(key, 1, ?) = ? ORDER BY key")) {
            stmt.setInt(1, prefix.length());
            stmt.setString(2, prefix);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString(1));
                }
            }
            return keys;
        } catch (SQLException e) {
            throw new StorageException("Failed to list records with prefix: " + prefix, e);
        }
    }

    @Override
    public synchronized boolean healthCheck() {
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            return false;
        }
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
                log.info("SQLiteRecordStore closed");
            } catch (SQLException e) {
                log.error("Failed to close SQLite connection", e);
            }
        }
    }
}
