package io.agentbridge.memory;

import io.agentbridge.cache.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.DriverManager;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteDurableStoreTest {

    @TempDir
    Path tempDir;

    private SQLiteDurableStore store;
    private String dbPath;

    @BeforeEach
    void setUp() {
        dbPath = tempDir.resolve("bridge.db").toString();
        store = new SQLiteDurableStore(dbPath, new EntryCodec());
        store.init();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static MemoryEntry entry(EntryCategory category, String key, Map<String, Object> payload,
                                     EntrySource source, Instant createdAt) {
        return new MemoryEntry(category, key, payload, source, MemoryType.BOTH, createdAt, null, null);
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    @Test
    void shouldPutAndGetEntry() {
        var written = new MemoryEntry(EntryCategory.MARKET_DATA, "EURUSD:bar:1", Map.of("close", 1.0853),
                EntrySource.TRADING_FRAMEWORK, MemoryType.BOTH, now(), Duration.ofMinutes(5), null);
        store.put(written);

        Optional<MemoryEntry> read = store.get(EntryCategory.MARKET_DATA, "EURUSD:bar:1");

        assertTrue(read.isPresent());
        assertEquals(written, read.get());
    }

    @Test
    void shouldReturnEmptyForMissingKey() {
        assertTrue(store.get(EntryCategory.AGENT_DECISION, "nope").isEmpty());
    }

    @Test
    void shouldKeepCategoriesApart() {
        store.put(entry(EntryCategory.MARKET_DATA, "same", Map.of("v", 1), EntrySource.SHARED, now()));

        assertTrue(store.get(EntryCategory.MARKET_DATA, "same").isPresent());
        assertTrue(store.get(EntryCategory.TRADING_SIGNAL, "same").isEmpty());
    }

    @Test
    void shouldOverwriteSameKey() {
        store.put(entry(EntryCategory.TRADING_SIGNAL, "sig-1", Map.of("side", "BUY"), EntrySource.AI_FRAMEWORK, now()));
        store.put(entry(EntryCategory.TRADING_SIGNAL, "sig-1", Map.of("side", "SELL"), EntrySource.AI_FRAMEWORK, now()));

        assertEquals("SELL", store.get(EntryCategory.TRADING_SIGNAL, "sig-1").orElseThrow().payload().get("side"));
        assertEquals(1L, store.counts().get(EntryCategory.TRADING_SIGNAL));
    }

    @Test
    void shouldRequireCreatedAt() {
        var unstamped = MemoryEntry.of(EntryCategory.MARKET_DATA, "k", Map.of(), EntrySource.SHARED, MemoryType.BOTH);
        assertThrows(IllegalArgumentException.class, () -> store.put(unstamped));
    }

    @Test
    void shouldListNewestFirstWithFilters() {
        Instant base = now().minusSeconds(60);
        store.put(entry(EntryCategory.MARKET_DATA, "EURUSD:bar:1", Map.of(), EntrySource.TRADING_FRAMEWORK, base));
        store.put(entry(EntryCategory.MARKET_DATA, "EURUSD:bar:2", Map.of(), EntrySource.TRADING_FRAMEWORK, base.plusSeconds(10)));
        store.put(entry(EntryCategory.MARKET_DATA, "GBPUSD:bar:1", Map.of(), EntrySource.TRADING_FRAMEWORK, base.plusSeconds(20)));
        store.put(entry(EntryCategory.MARKET_DATA, "EURUSD:note:1", Map.of(), EntrySource.AI_FRAMEWORK, base.plusSeconds(30)));

        List<MemoryEntry> all = store.list(EntryCategory.MARKET_DATA, EntryFilter.all());
        assertEquals(List.of("EURUSD:note:1", "GBPUSD:bar:1", "EURUSD:bar:2", "EURUSD:bar:1"),
                all.stream().map(MemoryEntry::key).toList());

        List<MemoryEntry> eurBars = store.list(EntryCategory.MARKET_DATA, EntryFilter.all().withKeyPrefix("EURUSD:bar:"));
        assertEquals(List.of("EURUSD:bar:2", "EURUSD:bar:1"), eurBars.stream().map(MemoryEntry::key).toList());

        List<MemoryEntry> fromAi = store.list(EntryCategory.MARKET_DATA, EntryFilter.all().withSource(EntrySource.AI_FRAMEWORK));
        assertEquals(1, fromAi.size());

        List<MemoryEntry> recent = store.list(EntryCategory.MARKET_DATA, EntryFilter.all().withSince(base.plusSeconds(15)));
        assertEquals(2, recent.size());

        List<MemoryEntry> latest = store.list(EntryCategory.MARKET_DATA, EntryFilter.latest("EURUSD:bar:"));
        assertEquals("EURUSD:bar:2", latest.get(0).key());
        assertEquals(1, latest.size());
    }

    @Test
    void shouldTreatLikeWildcardsInPrefixLiterally() {
        store.put(entry(EntryCategory.SYSTEM_STATE, "a_b", Map.of(), EntrySource.SHARED, now()));
        store.put(entry(EntryCategory.SYSTEM_STATE, "axb", Map.of(), EntrySource.SHARED, now()));

        List<MemoryEntry> matched = store.list(EntryCategory.SYSTEM_STATE, EntryFilter.all().withKeyPrefix("a_"));

        assertEquals(List.of("a_b"), matched.stream().map(MemoryEntry::key).toList());
    }

    @Test
    void shouldFilterByMinConfidence() {
        store.put(entry(EntryCategory.AGENT_DECISION, "a:buy:1", Map.of(), EntrySource.AI_FRAMEWORK, now()).withConfidence(0.9));
        store.put(entry(EntryCategory.AGENT_DECISION, "a:buy:2", Map.of(), EntrySource.AI_FRAMEWORK, now()).withConfidence(0.4));
        store.put(entry(EntryCategory.AGENT_DECISION, "a:buy:3", Map.of(), EntrySource.AI_FRAMEWORK, now()));

        List<MemoryEntry> confident = store.list(EntryCategory.AGENT_DECISION, EntryFilter.all().withMinConfidence(0.8));

        assertEquals(List.of("a:buy:1"), confident.stream().map(MemoryEntry::key).toList());
    }

    @Test
    void shouldSweepEntriesPastHorizon() {
        Instant old = now().minus(Duration.ofDays(10));
        store.put(entry(EntryCategory.MARKET_DATA, "old", Map.of(), EntrySource.SHARED, old));
        store.put(entry(EntryCategory.MARKET_DATA, "new", Map.of(), EntrySource.SHARED, now()));

        int removed = store.sweep(RetentionPolicy.keepFor(Duration.ofDays(7), 0));

        assertEquals(1, removed);
        assertTrue(store.get(EntryCategory.MARKET_DATA, "old").isEmpty());
        assertTrue(store.get(EntryCategory.MARKET_DATA, "new").isPresent());
    }

    @Test
    void shouldSweepBeyondCountBound() {
        Instant base = now().minusSeconds(100);
        for (int i = 0; i < 5; i++) {
            store.put(entry(EntryCategory.TRADING_SIGNAL, "sig-" + i, Map.of(), EntrySource.SHARED, base.plusSeconds(i)));
        }

        int removed = store.sweep(new RetentionPolicy(Map.of(), 2));

        assertEquals(3, removed);
        assertEquals(List.of("sig-4", "sig-3"),
                store.list(EntryCategory.TRADING_SIGNAL, EntryFilter.all()).stream().map(MemoryEntry::key).toList());
    }

    @Test
    void shouldKeepUnprocessedEventsPastHorizon() {
        Instant old = now().minus(Duration.ofDays(30));
        store.put(event("evt-1", "market_bar_received", "AI_FRAMEWORK", old));
        store.put(event("evt-2", "market_bar_received", "AI_FRAMEWORK", old));
        store.markEventProcessed("evt-2");

        int removed = store.sweep(RetentionPolicy.keepFor(Duration.ofDays(7), 0));

        assertEquals(1, removed);
        assertTrue(store.get(EntryCategory.EVENT, "evt-1").isPresent());
        assertTrue(store.get(EntryCategory.EVENT, "evt-2").isEmpty());
    }

    @Test
    void shouldExpireUnprocessedEventsPastPendingAge() {
        store.put(event("evt-stale", "market_bar_received", "AI_FRAMEWORK", now().minus(Duration.ofDays(40))));
        store.put(event("evt-waiting", "market_bar_received", "AI_FRAMEWORK", now().minus(Duration.ofDays(10))));

        int removed = store.sweep(RetentionPolicy.keepFor(Duration.ofDays(7), 0, Duration.ofDays(30)));

        assertEquals(1, removed);
        assertTrue(store.get(EntryCategory.EVENT, "evt-stale").isEmpty());
        assertTrue(store.get(EntryCategory.EVENT, "evt-waiting").isPresent());
    }

    @Test
    void shouldApplyCountBoundToUnprocessedEvents() {
        Instant base = now().minusSeconds(100);
        for (int i = 0; i < 4; i++) {
            store.put(event("evt-" + i, "market_tick_received", "AI_FRAMEWORK", base.plusSeconds(i)));
        }

        int removed = store.sweep(new RetentionPolicy(Map.of(), 2));

        assertEquals(2, removed);
        assertEquals(List.of("evt-2", "evt-3"),
                store.pendingEvents(null, 10).stream().map(MemoryEntry::key).toList());
    }

    @Test
    void shouldTakeSweepCutoffFromInjectedClock() {
        Instant start = Instant.parse("2026-01-05T12:00:00Z");
        MutableClock clock = new MutableClock(start);
        var clocked = new SQLiteDurableStore(tempDir.resolve("clocked.db").toString(), new EntryCodec(), clock);
        clocked.init();
        try {
            clocked.put(entry(EntryCategory.MARKET_DATA, "EURUSD:bar:1", Map.of(), EntrySource.SHARED, start));
            RetentionPolicy weekly = RetentionPolicy.keepFor(Duration.ofDays(7), 0);

            assertEquals(0, clocked.sweep(weekly));

            clock.advance(Duration.ofDays(8));

            assertEquals(1, clocked.sweep(weekly));
            assertTrue(clocked.get(EntryCategory.MARKET_DATA, "EURUSD:bar:1").isEmpty());
        } finally {
            clocked.close();
        }
    }

    @Test
    void shouldReturnPendingEventsForTargetOldestFirst() {
        Instant base = now().minusSeconds(30);
        store.put(event("evt-a", "agent_decision_made", "TRADING_FRAMEWORK", base));
        store.put(event("evt-b", "market_bar_received", "AI_FRAMEWORK", base.plusSeconds(1)));
        store.put(event("evt-c", "trading_signal_generated", null, base.plusSeconds(2)));
        store.put(event("evt-d", "high_confidence_signal", "TRADING_FRAMEWORK", base.plusSeconds(3)));
        store.markEventProcessed("evt-d");

        List<MemoryEntry> forTrading = store.pendingEvents(EntrySource.TRADING_FRAMEWORK, 10);
        assertEquals(List.of("evt-a", "evt-c"), forTrading.stream().map(MemoryEntry::key).toList());
        assertEquals(Boolean.FALSE, forTrading.get(0).payload().get("processed"));

        assertEquals(3, store.pendingEvents(null, 10).size());
        assertEquals(1, store.pendingEvents(null, 1).size());
    }

    @Test
    void shouldMarkEventProcessed() {
        store.put(event("evt-1", "market_tick_received", "AI_FRAMEWORK", now()));

        assertTrue(store.markEventProcessed("evt-1"));
        assertFalse(store.markEventProcessed("evt-missing"));
        assertEquals(Boolean.TRUE, store.get(EntryCategory.EVENT, "evt-1").orElseThrow().payload().get("processed"));
    }

    @Test
    void shouldStoreEventWithoutTypeUnderDefaultType() throws Exception {
        var untyped = entry(EntryCategory.EVENT, "evt-x", Map.of("note", "manual"), EntrySource.SHARED, now());

        store.put(untyped);

        assertEquals("manual", store.get(EntryCategory.EVENT, "evt-x").orElseThrow().payload().get("note"));
        assertEquals(List.of("evt-x"),
                store.pendingEvents(null, 10).stream().map(MemoryEntry::key).toList());
        try (var conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
             var stmt = conn.prepareStatement("SELECT event_type FROM events WHERE key = ?")) {
            stmt.setString(1, "evt-x");
            try (var rs = stmt.executeQuery()) {
                assertTrue(rs.next());
                assertEquals(DurableStore.DEFAULT_EVENT_TYPE, rs.getString(1));
            }
        }
    }

    @Test
    void shouldKeepOneRowWhenWritersRaceOnSameKey() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 20; i++) {
                        store.put(entry(EntryCategory.SYSTEM_STATE, "engine",
                                Map.of("writer", writer, "seq", i), EntrySource.SHARED, now()));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1L, store.counts().get(EntryCategory.SYSTEM_STATE));
        Map<String, Object> last = store.get(EntryCategory.SYSTEM_STATE, "engine").orElseThrow().payload();
        assertEquals(19L, last.get("seq"));
        assertTrue((Long) last.get("writer") >= 0 && (Long) last.get("writer") < writers);
    }

    @Test
    void shouldSurviveReopen() {
        store.put(entry(EntryCategory.SYSTEM_STATE, "engine", Map.of("status", "running"), EntrySource.SHARED, now()));
        store.close();

        var reopened = new SQLiteDurableStore(dbPath, new EntryCodec());
        reopened.init();
        try {
            assertEquals("running", reopened.get(EntryCategory.SYSTEM_STATE, "engine").orElseThrow().payload().get("status"));
        } finally {
            reopened.close();
        }
    }

    @Test
    void shouldFailAfterClose() {
        store.close();

        assertThrows(StoreException.class, () -> store.get(EntryCategory.MARKET_DATA, "k"));
        assertFalse(store.healthCheck());
    }

    @Test
    void shouldReportHealthAndCounts() {
        assertTrue(store.healthCheck());
        store.put(entry(EntryCategory.MARKET_DATA, "a", Map.of(), EntrySource.SHARED, now()));
        store.put(entry(EntryCategory.MARKET_DATA, "b", Map.of(), EntrySource.SHARED, now()));

        Map<EntryCategory, Long> counts = store.counts();

        assertEquals(2L, counts.get(EntryCategory.MARKET_DATA));
        assertEquals(0L, counts.get(EntryCategory.EVENT));
        assertEquals(EntryCategory.values().length, counts.size());
    }

    private static MemoryEntry event(String id, String type, String target, Instant createdAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", type);
        payload.put("event_data", Map.of());
        payload.put("target", target);
        payload.put("processed", false);
        return new MemoryEntry(EntryCategory.EVENT, id, payload, EntrySource.SHARED, MemoryType.PERSISTENT_ONLY,
                createdAt, null, null);
    }
}
