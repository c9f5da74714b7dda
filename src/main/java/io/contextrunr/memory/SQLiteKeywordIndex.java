package io.contextrunr.memory;

import io.contextrunr.storage.RecordCodec;
import io.contextrunr.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Keyword retrieval backend on SQLite FTS5.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code memory_index}: memory id, owner, content and the encoded memory document</li>
 *   <li>{@code memory_index_fts}: FTS5 virtual table over content, kept in sync by triggers</li>
 * </ul>
 *
 * <p>BM25 ranks are normalized to relevance {@code 1 / (1 + |rank|)}.</p>
 */
public class SQLiteKeywordIndex implements MemoryRetrievalBackend, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SQLiteKeywordIndex.class);
    private static final double FALLBACK_RELEVANCE = 0.5;

    private final String dbPath;
    private final RecordCodec codec;
    private Connection connection;

    public SQLiteKeywordIndex(String dbPath, RecordCodec codec) {
        this.dbPath = dbPath;
        this.codec = codec;
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
            }
            createSchema();
            log.info("SQLiteKeywordIndex initialized at: {}", dbPath);
        } catch (SQLException | IOException e) {
            log.error("Failed to initialize keyword index at {}", dbPath, e);
            throw new StorageException("Keyword index initialization failed", e);
        }
    }

    private void createSchema() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memory_index (
                    id TEXT PRIMARY KEY,
                    user_id TEXT NOT NULL,
                    content TEXT NOT NULL,
                    document TEXT NOT NULL
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_memory_index_user ON memory_index(user_id)
                """);

            stmt.execute("""
                CREATE VIRTUAL TABLE IF NOT EXISTS memory_index_fts USING fts5(
                    content,
                    content=memory_index,
                    content_rowid=rowid
                )
                """);

            stmt.execute("""
                CREATE TRIGGER IF NOT EXISTS memory_index_ai AFTER INSERT ON memory_index BEGIN
                    INSERT INTO memory_index_fts(rowid, content) VALUES (new.rowid, new.content);
                END
                """);

            stmt.execute("""
                CREATE TRIGGER IF NOT EXISTS memory_index_ad AFTER DELETE ON memory_index BEGIN
                    INSERT INTO memory_index_fts(memory_index_fts, rowid, content)
                    VALUES ('delete', old.rowid, old.content);
                END
                """);

            stmt.execute("""
                CREATE TRIGGER IF NOT EXISTS memory_index_au AFTER UPDATE ON memory_index BEGIN
                    INSERT INTO memory_index_fts(memory_index_fts, rowid, content)
                    VALUES ('delete', old.rowid, old.content);
                    INSERT INTO memory_index_fts(rowid, content) VALUES (new.rowid, new.content);
                END
                """);
        }
    }

    @Override
    public String name() {
        return "sqlite-fts";
    }

    @Override
    public synchronized void index(Memory memory) {
        String sql = """
            INSERT INTO memory_index (id, user_id, content, document) VALUES (?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET user_id = excluded.user_id, content = excluded.content,
                                          document = excluded.document
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, memory.id());
            stmt.setString(2, memory.userId());
            stmt.setString(3, memory.content());
            stmt.setString(4, codec.encodeMemory(memory));
            stmt.executeUpdate();
            log.debug("Indexed memory {}", memory.id());
        } catch (SQLException e) {
            throw new StorageException("Failed to index memory: " + memory.id(), e);
        }
    }

    @Override
    public synchronized void remove(String memoryId) {
        try (var stmt = connection.prepareStatement("DELETE FROM memory_index WHERE id = ?")) {
            stmt.setString(1, memoryId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to remove memory from index: " + memoryId, e);
        }
    }

    @Override
    public synchronized List<ScoredMemory> search(String userId, String query, int topK) {
        if (query == null || query.isBlank() || topK <= 0) {
            return List.of();
        }

        String sql = """
            SELECT m.document, bm25(memory_index_fts) AS rank
            FROM memory_index_fts f
            JOIN memory_index m ON m.rowid = f.rowid
            WHERE memory_index_fts MATCH ? AND m.user_id = ?
            ORDER BY rank
            LIMIT ?
            """;

        List<ScoredMemory> results = new ArrayList<>();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, buildFtsQuery(query));
            stmt.setString(2, userId);
            stmt.setInt(3, topK);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    // BM25 returns negative values, lower = better
                    double rank = Math.abs(rs.getDouble("rank"));
                    results.add(new ScoredMemory(toMemory(rs), 1.0 / (1.0 + rank)));
                }
            }
        } catch (SQLException e) {
            log.debug("FTS search failed, falling back to LIKE search: {}", e.getMessage());
            return searchFallback(userId, query, topK);
        }
        return results;
    }

    /** Fallback search using LIKE when FTS rejects the query. */
    private List<ScoredMemory> searchFallback(String userId, String query, int topK) {
        String likePattern = "%" + query.replace("%", "").replace("_", "") + "%";
        String sql = """
            SELECT document FROM memory_index
            WHERE user_id = ? AND content LIKE ?
            LIMIT ?
            """;

        List<ScoredMemory> results = new ArrayList<>();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, userId);
            stmt.setString(2, likePattern);
            stmt.setInt(3, topK);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(new ScoredMemory(toMemory(rs), FALLBACK_RELEVANCE));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Keyword search failed for user " + userId, e);
        }
        return results;
    }

    public synchronized int count() {
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT COUNT(*) FROM memory_index")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to count indexed memories", e);
        }
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
                log.info("SQLiteKeywordIndex closed");
            } catch (SQLException e) {
                log.error("Failed to close SQLite connection", e);
            }
        }
    }

    /** Builds a safe FTS5 query: one quoted prefix term per word, OR-ed together. */
    static String buildFtsQuery(String query) {
        String[] words = query.trim().split("\\s+");
        StringJoiner fts = new StringJoiner(" OR ");
        for (String word : words) {
            String clean = word.replaceAll("[\"'*(){}\\[\\]^~:+\\-]", "").trim();
            if (!clean.isEmpty()) {
                fts.add("\"" + clean + "\"*");
            }
        }
        String result = fts.toString();
        return result.isEmpty() ? "\"" + query.replaceAll("[\"']", "") + "\"" : result;
    }

    private Memory toMemory(ResultSet rs) throws SQLException {
        return codec.decodeMemory(rs.getString("document"));
    }
}
