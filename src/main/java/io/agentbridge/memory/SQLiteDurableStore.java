package io.agentbridge.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed durable store with one table per category.
 *
 * <p>Schema (every category table):</p>
 * <ul>
 *   <li>{@code key}: primary key, unique within the category</li>
 *   <li>{@code payload}: JSON of the entry payload</li>
 *   <li>{@code source}, {@code memory_type}, {@code created_at} (epoch ms),
 *       {@code ttl_ms}, {@code confidence}, {@code updated_at}</li>
 * </ul>
 * <p>The {@code events} table additionally carries {@code event_type}, {@code target}
 * and {@code processed} so that pending events can be queried.</p>
 *
 * <p>Each operation borrows its own connection; the database runs in WAL mode so
 * readers do not wait on writers. Writes to the same key are serialized by a striped lock.</p>
 */
public class SQLiteDurableStore implements DurableStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteDurableStore.class);

    private static final int LOCK_STRIPES = 64;
    private static final String EVENT_TYPE = "event_type";
    private static final String EVENT_TARGET = "target";
    private static final String EVENT_PROCESSED = "processed";

    private final String dbPath;
    private final EntryCodec codec;
    private final Clock clock;
    private final ReentrantLock[] keyLocks = new ReentrantLock[LOCK_STRIPES];
    private SQLiteDataSource dataSource;
    private volatile boolean closed;

    public SQLiteDurableStore(String dbPath, EntryCodec codec) {
        this(dbPath, codec, Clock.systemUTC());
    }

    /**
     * @param clock source of {@code updated_at} and of the retention cutoff
     */
    public SQLiteDurableStore(String dbPath, EntryCodec codec, Clock clock) {
        this.dbPath = dbPath;
        this.codec = codec;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            keyLocks[i] = new ReentrantLock();
        }
    }

    public void init() {
        Path parent = Path.of(dbPath).toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new StoreException("Failed to create store directory: " + parent, e);
            }
        }

        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(5000);
        config.enableCaseSensitiveLike(true);
        dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbPath);

        try {
            createSchema();
            log.info("SQLiteDurableStore initialized at: {}", dbPath);
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite durable store at {}", dbPath, e);
            throw new StoreException("Durable store initialization failed", e);
        }
    }

    private void createSchema() throws SQLException {
        try (var conn = connection(); var stmt = conn.createStatement()) {
            for (EntryCategory category : EntryCategory.values()) {
                String table = category.tableName();
                String eventColumns = category == EntryCategory.EVENT
                        ? """
                          ,
                              event_type TEXT NOT NULL,
                              target TEXT,
                              processed INTEGER NOT NULL DEFAULT 0
                          """
                        : "";
                stmt.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        key TEXT PRIMARY KEY,
                        payload TEXT NOT NULL,
                        source TEXT NOT NULL,
                        memory_type TEXT NOT NULL,
                        created_at INTEGER NOT NULL,
                        ttl_ms INTEGER,
                        confidence REAL,
                        updated_at INTEGER NOT NULL%s
                    )
                    """.formatted(table, eventColumns));

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_%s_created ON %s(created_at)".formatted(table, table));
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_%s_source ON %s(source)".formatted(table, table));
            }
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_events_pending ON events(processed, target)");
        }
    }

    @Override
    public void put(MemoryEntry entry) {
        if (entry.createdAt() == null) {
            throw new IllegalArgumentException("Entry must carry createdAt before it is stored: " + entry.key());
        }
        String payloadJson = codec.encodePayload(stripEventColumns(entry));
        ReentrantLock lock = lockFor(entry.category(), entry.key());
        lock.lock();
        try (var conn = connection()) {
            if (entry.category() == EntryCategory.EVENT) {
                upsertEvent(conn, entry, payloadJson);
            } else {
                upsertEntry(conn, entry, payloadJson);
            }
            log.debug("Stored entry: category={}, key='{}'", entry.category(), entry.key());
        } catch (SQLException e) {
            log.error("Failed to store entry: category={}, key='{}'", entry.category(), entry.key(), e);
            throw new StoreException("Failed to store %s/%s".formatted(entry.category(), entry.key()), e);
        } finally {
            lock.unlock();
        }
    }

    private void upsertEntry(Connection conn, MemoryEntry entry, String payloadJson) throws SQLException {
        String sql = """
            INSERT INTO %s (key, payload, source, memory_type, created_at, ttl_ms, confidence, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(key) DO UPDATE SET
                payload = excluded.payload,
                source = excluded.source,
                memory_type = excluded.memory_type,
                created_at = excluded.created_at,
                ttl_ms = excluded.ttl_ms,
                confidence = excluded.confidence,
                updated_at = excluded.updated_at
            """.formatted(entry.category().tableName());
        try (var stmt = conn.prepareStatement(sql)) {
            bindCommon(stmt, entry, payloadJson);
            stmt.executeUpdate();
        }
    }

    private void upsertEvent(Connection conn, MemoryEntry entry, String payloadJson) throws SQLException {
        Object eventType = entry.payload().get(EVENT_TYPE);
        if (eventType == null) {
            eventType = DEFAULT_EVENT_TYPE;
        }
        Object target = entry.payload().get(EVENT_TARGET);
        boolean processed = Boolean.TRUE.equals(entry.payload().get(EVENT_PROCESSED));

        String sql = """
            INSERT INTO events (key, payload, source, memory_type, created_at, ttl_ms, confidence, updated_at,
                                event_type, target, processed)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(key) DO UPDATE SET
                payload = excluded.payload,
                source = excluded.source,
                memory_type = excluded.memory_type,
                created_at = excluded.created_at,
                ttl_ms = excluded.ttl_ms,
                confidence = excluded.confidence,
                updated_at = excluded.updated_at,
                event_type = excluded.event_type,
                target = excluded.target,
                processed = excluded.processed
            """;
        try (var stmt = conn.prepareStatement(sql)) {
            bindCommon(stmt, entry, payloadJson);
            stmt.setString(9, eventType.toString());
            if (target == null) {
                stmt.setNull(10, Types.VARCHAR);
            } else {
                stmt.setString(10, target.toString());
            }
            stmt.setInt(11, processed ? 1 : 0);
            stmt.executeUpdate();
        }
    }

    private void bindCommon(PreparedStatement stmt, MemoryEntry entry, String payloadJson) throws SQLException {
        stmt.setString(1, entry.key());
        stmt.setString(2, payloadJson);
        stmt.setString(3, entry.source().name());
        stmt.setString(4, entry.memoryType().name());
        stmt.setLong(5, entry.createdAt().toEpochMilli());
        if (entry.ttl() == null) {
            stmt.setNull(6, Types.INTEGER);
        } else {
            stmt.setLong(6, entry.ttl().toMillis());
        }
        if (entry.confidence() == null) {
            stmt.setNull(7, Types.REAL);
        } else {
            stmt.setDouble(7, entry.confidence());
        }
        stmt.setLong(8, clock.millis());
    }

    @Override
    public Optional<MemoryEntry> get(EntryCategory category, String key) {
        String sql = "SELECT * FROM %s WHERE key = ?".formatted(category.tableName());

        try (var conn = connection(); var stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, key);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(toEntry(category, rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to get entry: category={}, key='{}'", category, key, e);
            throw new StoreException("Failed to read %s/%s".formatted(category, key), e);
        }

        return Optional.empty();
    }

    @Override
    public List<MemoryEntry> list(EntryCategory category, EntryFilter filter) {
        EntryFilter f = filter == null ? EntryFilter.all() : filter;
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(category.tableName()).append(" WHERE 1 = 1");
        List<Object> params = new ArrayList<>();

        if (f.source() != null) {
            sql.append(" AND source = ?");
            params.add(f.source().name());
        }
        if (f.since() != null) {
            sql.append(" AND created_at >= ?");
            params.add(f.since().toEpochMilli());
        }
        if (f.keyPrefix() != null && !f.keyPrefix().isEmpty()) {
            sql.append(" AND key LIKE ? ESCAPE '\\'");
            params.add(escapeLike(f.keyPrefix()) + "%");
        }
        if (f.minConfidence() != null) {
            sql.append(" AND confidence >= ?");
            params.add(f.minConfidence());
        }
        sql.append(" ORDER BY created_at DESC, rowid DESC LIMIT ?");
        params.add(f.limit());

        List<MemoryEntry> results = new ArrayList<>();
        try (var conn = connection(); var stmt = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(toEntry(category, rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list entries for category={}", category, e);
            throw new StoreException("Failed to list " + category, e);
        }
        return results;
    }

    @Override
    public int sweep(RetentionPolicy policy) {
        int removed = 0;
        long now = clock.millis();

        try (var conn = connection()) {
            for (EntryCategory category : EntryCategory.values()) {
                String table = category.tableName();
                boolean events = category == EntryCategory.EVENT;

                Duration horizon = policy.horizonFor(category);
                if (horizon != null) {
                    String onlyHandled = events ? " AND processed = 1" : "";
                    removed += deleteOlderThan(conn, table, now - horizon.toMillis(), onlyHandled);
                }
                if (events && policy.pendingEventMaxAge() != null) {
                    removed += deleteOlderThan(conn, table, now - policy.pendingEventMaxAge().toMillis(),
                            " AND processed = 0");
                }

                if (policy.isCountBounded()) {
                    String sql = """
                        DELETE FROM %1$s WHERE key NOT IN (
                            SELECT key FROM %1$s ORDER BY created_at DESC, rowid DESC LIMIT ?
                        )
                        """.formatted(table);
                    try (var stmt = conn.prepareStatement(sql)) {
                        stmt.setInt(1, policy.maxEntriesPerCategory());
                        removed += stmt.executeUpdate();
                    }
                }
            }
        } catch (SQLException e) {
            log.error("Retention sweep failed after removing {} entries", removed, e);
            throw new StoreException("Retention sweep failed", e);
        }

        if (removed > 0) {
            log.info("Retention sweep removed {} entries", removed);
        }
        return removed;
    }

    private int deleteOlderThan(Connection conn, String table, long cutoff, String condition) throws SQLException {
        try (var stmt = conn.prepareStatement(
                "DELETE FROM %s WHERE created_at < ?%s".formatted(table, condition))) {
            stmt.setLong(1, cutoff);
            return stmt.executeUpdate();
        }
    }

    @Override
    public List<MemoryEntry> pendingEvents(EntrySource target, int limit) {
        String sql = target == null
                ? "SELECT * FROM events WHERE processed = 0 ORDER BY created_at ASC, rowid ASC LIMIT ?"
                : """
                  SELECT * FROM events
                  WHERE processed = 0 AND (target IS NULL OR target = ?)
                  ORDER BY created_at ASC, rowid ASC
                  LIMIT ?
                  """;

        List<MemoryEntry> results = new ArrayList<>();
        try (var conn = connection(); var stmt = conn.prepareStatement(sql)) {
            if (target == null) {
                stmt.setInt(1, limit);
            } else {
                stmt.setString(1, target.name());
                stmt.setInt(2, limit);
            }
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(toEntry(EntryCategory.EVENT, rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load pending events for target={}", target, e);
            throw new StoreException("Failed to load pending events", e);
        }
        return results;
    }

    @Override
    public boolean markEventProcessed(String eventId) {
        ReentrantLock lock = lockFor(EntryCategory.EVENT, eventId);
        lock.lock();
        try (var conn = connection();
             var stmt = conn.prepareStatement("UPDATE events SET processed = 1, updated_at = ? WHERE key = ?")) {
            stmt.setLong(1, clock.millis());
            stmt.setString(2, eventId);
            boolean updated = stmt.executeUpdate() > 0;
            if (updated) {
                log.debug("Marked event processed: {}", eventId);
            }
            return updated;
        } catch (SQLException e) {
            log.error("Failed to mark event processed: {}", eventId, e);
            throw new StoreException("Failed to mark event processed: " + eventId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<EntryCategory, Long> counts() {
        Map<EntryCategory, Long> counts = new EnumMap<>(EntryCategory.class);
        try (var conn = connection(); var stmt = conn.createStatement()) {
            for (EntryCategory category : EntryCategory.values()) {
                try (var rs = stmt.executeQuery("SELECT COUNT(*) FROM " + category.tableName())) {
                    counts.put(category, rs.next() ? rs.getLong(1) : 0L);
                }
            }
        } catch (SQLException e) {
            log.error("Failed to count entries", e);
            throw new StoreException("Failed to count entries", e);
        }
        return counts;
    }

    @Override
    public boolean healthCheck() {
        try (var conn = connection();
             var stmt = conn.createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException | StoreException e) {
            log.debug("Durable store health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("SQLiteDurableStore closed");
        }
    }

    private Connection connection() throws SQLException {
        if (closed) {
            throw new StoreException("Durable store is closed");
        }
        if (dataSource == null) {
            throw new StoreException("Durable store is not initialized");
        }
        return dataSource.getConnection();
    }

    private ReentrantLock lockFor(EntryCategory category, String key) {
        int hash = 31 * category.ordinal() + key.hashCode();
        return keyLocks[Math.floorMod(hash, LOCK_STRIPES)];
    }

    /** Event bookkeeping fields live in their own columns, not in the payload JSON. */
    private Map<String, Object> stripEventColumns(MemoryEntry entry) {
        if (entry.category() != EntryCategory.EVENT) {
            return entry.payload();
        }
        Map<String, Object> payload = new LinkedHashMap<>(entry.payload());
        payload.remove(EVENT_PROCESSED);
        return payload;
    }

    private MemoryEntry toEntry(EntryCategory category, ResultSet rs) throws SQLException {
        Map<String, Object> payload = codec.decodePayload(rs.getString("payload"));
        if (category == EntryCategory.EVENT) {
            payload = new LinkedHashMap<>(payload);
            payload.put(EVENT_PROCESSED, rs.getInt("processed") == 1);
        }

        long ttlMs = rs.getLong("ttl_ms");
        Duration ttl = rs.wasNull() ? null : Duration.ofMillis(ttlMs);
        double confidence = rs.getDouble("confidence");
        Double conf = rs.wasNull() ? null : confidence;

        return new MemoryEntry(
                category,
                rs.getString("key"),
                payload,
                EntrySource.valueOf(rs.getString("source")),
                MemoryType.valueOf(rs.getString("memory_type")),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                ttl,
                conf
        );
    }

    private static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
