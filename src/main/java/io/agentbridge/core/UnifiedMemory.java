package io.agentbridge.core;

import io.agentbridge.cache.CacheWrite;
import io.agentbridge.cache.VolatileCache;
import io.agentbridge.event.BridgeEvent;
import io.agentbridge.event.EventBus;
import io.agentbridge.event.EventHandler;
import io.agentbridge.event.Subscription;
import io.agentbridge.memory.DurableStore;
import io.agentbridge.memory.EntryCategory;
import io.agentbridge.memory.EntryCodec;
import io.agentbridge.memory.EntryFilter;
import io.agentbridge.memory.EntrySource;
import io.agentbridge.memory.MemoryEntry;
import io.agentbridge.memory.RetentionPolicy;
import io.agentbridge.memory.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single entry point both subsystems use to share data.
 *
 * <p>Writes are routed by {@link io.agentbridge.memory.MemoryType}: cache-only entries go to the
 * volatile cache, persistent-only entries to the durable store, and {@code BOTH} entries to the
 * cache first (best effort) and then to the durable store (authoritative). The durable store
 * always wins: a cached copy is only an accelerator and is removed when the durable write fails.</p>
 *
 * <p>Reads try the cache first and fall back to the durable store. A store hit is not copied
 * back into the cache; use {@link #refresh} for that.</p>
 *
 * <p>Thread-safe. Writes and refreshes of the same key are serialized so the cached copy and the
 * durable copy always come from the same write. Constructed once per process and shared by reference.</p>
 */
public class UnifiedMemory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UnifiedMemory.class);

    private static final int LOCK_STRIPES = 64;

    public static final Map<EntryCategory, Duration> DEFAULT_TTLS = Map.of(
            EntryCategory.MARKET_DATA, Duration.ofHours(1),
            EntryCategory.AGENT_DECISION, Duration.ofMinutes(30),
            EntryCategory.TRADING_SIGNAL, Duration.ofMinutes(15),
            EntryCategory.SYSTEM_STATE, Duration.ofMinutes(5),
            EntryCategory.EVENT, Duration.ofMinutes(5)
    );

    private final DurableStore store;
    private final VolatileCache cache;
    private final EventBus eventBus;
    private final EntryCodec codec;
    private final Map<EntryCategory, Duration> defaultTtls;
    private final Clock clock;

    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ReentrantLock[] keyLocks = new ReentrantLock[LOCK_STRIPES];

    public UnifiedMemory(DurableStore store, VolatileCache cache, EventBus eventBus, EntryCodec codec,
                         Map<EntryCategory, Duration> defaultTtls, Clock clock) {
        this.store = store;
        this.cache = cache;
        this.eventBus = eventBus;
        this.codec = codec;
        this.clock = clock;

        Map<EntryCategory, Duration> ttls = new EnumMap<>(DEFAULT_TTLS);
        if (defaultTtls != null) {
            ttls.putAll(defaultTtls);
        }
        this.defaultTtls = ttls;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            keyLocks[i] = new ReentrantLock();
        }
    }

    public UnifiedMemory(DurableStore store, VolatileCache cache, EntryCodec codec, Clock clock) {
        this(store, cache, new EventBus(store, clock), codec, DEFAULT_TTLS, clock);
    }

    // --- Writes ---

    /**
     * Writes an entry according to its memory type. {@code createdAt} is set here.
     *
     * @return {@code OK}, {@code PARTIAL_FAILURE} when the cache backend went down during a
     *         {@code BOTH} write (reported once per outage), or {@code FAILURE} when the durable write failed
     * @throws IllegalArgumentException if the payload cannot be serialized
     */
    public WriteResult write(MemoryEntry entry) {
        MemoryEntry stamped = entry.withCreatedAt(clock.instant().truncatedTo(ChronoUnit.MILLIS));

        ReentrantLock lock = lockFor(stamped.category(), stamped.key());
        lock.lock();
        try {
            return switch (stamped.memoryType()) {
                case CACHE_ONLY -> writeCacheOnly(stamped);
                case PERSISTENT_ONLY -> writePersistentOnly(stamped);
                case BOTH -> writeBoth(stamped);
            };
        } finally {
            lock.unlock();
        }
    }

    private WriteResult writeCacheOnly(MemoryEntry entry) {
        CacheWrite landed = cacheSet(entry, false);
        log.debug("Cached {}:{} ({})", entry.category(), entry.key(), landed);
        return landed == CacheWrite.FALLBACK
                ? WriteResult.ok(entry, "cache backend unavailable, stored in-process")
                : WriteResult.ok(entry);
    }

    private WriteResult writePersistentOnly(MemoryEntry entry) {
        try {
            store.put(entry);
        } catch (StoreException e) {
            log.error("Durable write failed for {}:{}", entry.category(), entry.key(), e);
            return WriteResult.failure(entry, e.getMessage());
        }
        // an older cached generation of this key must not shadow the durable copy
        cache.delete(entry.category(), entry.key());
        log.debug("Persisted {}:{}", entry.category(), entry.key());
        return WriteResult.ok(entry);
    }

    private WriteResult writeBoth(MemoryEntry entry) {
        CacheWrite landed = cacheSet(entry, true);
        try {
            store.put(entry);
        } catch (StoreException e) {
            cache.delete(entry.category(), entry.key());
            log.error("Durable write failed for {}:{}, cached copy removed", entry.category(), entry.key(), e);
            return WriteResult.failure(entry, e.getMessage());
        }

        if (landed == CacheWrite.FALLBACK) {
            if (cache.consumeDegradedNotice()) {
                String detail = "cache backend unavailable, durable copy written";
                log.warn("Partial failure writing {}:{}: {}", entry.category(), entry.key(), detail);
                return WriteResult.partialFailure(entry, detail);
            }
            return WriteResult.ok(entry, "cache degraded, stored in-process");
        }
        log.debug("Stored {}:{} in cache and durable store", entry.category(), entry.key());
        return WriteResult.ok(entry);
    }

    private CacheWrite cacheSet(MemoryEntry entry, boolean durableCopy) {
        return cache.set(entry.category(), entry.key(), codec.encodeEntry(entry), ttlOf(entry), durableCopy);
    }

    private Duration ttlOf(MemoryEntry entry) {
        return entry.ttl() != null ? entry.ttl() : defaultTtls.get(entry.category());
    }

    private ReentrantLock lockFor(EntryCategory category, String key) {
        int hash = 31 * category.ordinal() + key.hashCode();
        return keyLocks[Math.floorMod(hash, LOCK_STRIPES)];
    }

    // --- Reads ---

    public Optional<MemoryEntry> read(EntryCategory category, String key) {
        return read(category, key, true);
    }

    /**
     * Reads an entry.
     *
     * @param preferCache when false the durable store is consulted first and the cache only
     *                    for entries the store does not hold (cache-only entries)
     * @return the entry, or empty if no tier holds it
     * @throws StoreException if the durable store could not be read
     */
    public Optional<MemoryEntry> read(EntryCategory category, String key, boolean preferCache) {
        if (preferCache) {
            Optional<MemoryEntry> cached = readCache(category, key);
            return cached.isPresent() ? cached : store.get(category, key);
        }
        Optional<MemoryEntry> durable = store.get(category, key);
        return durable.isPresent() ? durable : readCache(category, key);
    }

    private Optional<MemoryEntry> readCache(EntryCategory category, String key) {
        Optional<String> raw = cache.get(category, key);
        if (raw.isEmpty()) {
            cacheMisses.increment();
            return Optional.empty();
        }
        try {
            MemoryEntry entry = codec.decodeEntry(raw.get());
            cacheHits.increment();
            return Optional.of(entry);
        } catch (IllegalArgumentException | ClassCastException e) {
            // unreadable cache values are dropped; the durable copy is authoritative
            log.warn("Discarding unreadable cache value for {}:{}: {}", category, key, e.getMessage());
            cache.delete(category, key);
            cacheMisses.increment();
            return Optional.empty();
        }
    }

    /**
     * Newest durable entry whose key starts with the prefix.
     */
    public Optional<MemoryEntry> readLatest(EntryCategory category, String keyPrefix) {
        List<MemoryEntry> latest = store.list(category, EntryFilter.latest(keyPrefix));
        return latest.isEmpty() ? Optional.empty() : Optional.of(latest.get(0));
    }

    /**
     * Durable entries of a category, newest first.
     */
    public List<MemoryEntry> list(EntryCategory category, EntryFilter filter) {
        return store.list(category, filter == null ? EntryFilter.all() : filter);
    }

    /**
     * Copies the durable entry into the cache.
     *
     * @return the durable entry, or empty if the store does not hold the key
     */
    public Optional<MemoryEntry> refresh(EntryCategory category, String key) {
        ReentrantLock lock = lockFor(category, key);
        lock.lock();
        try {
            Optional<MemoryEntry> durable = store.get(category, key);
            durable.ifPresent(entry -> {
                CacheWrite landed = cacheSet(entry, true);
                log.debug("Refreshed {}:{} into cache ({})", category, key, landed);
            });
            return durable;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Durable entries of a category that are still within their time-to-live, newest first.
     * Entries without their own TTL use the category default. Only the newest {@code limit}
     * entries are considered.
     */
    public List<MemoryEntry> listActive(EntryCategory category, int limit) {
        Instant now = clock.instant();
        return store.list(category, EntryFilter.all().withLimit(limit)).stream()
                .filter(entry -> entry.createdAt().plus(ttlOf(entry)).isAfter(now))
                .toList();
    }

    // --- Events ---

    /**
     * @throws StoreException if the event could not be logged; no handler is invoked in that case
     */
    public BridgeEvent publish(BridgeEvent event) {
        return eventBus.publish(event);
    }

    public Subscription subscribe(String eventType, EventHandler handler) {
        return eventBus.subscribe(eventType, handler);
    }

    public Subscription subscribe(EntrySource target, EventHandler handler) {
        return eventBus.subscribe(target, handler);
    }

    public Subscription subscribeAll(EventHandler handler) {
        return eventBus.subscribeAll(handler);
    }

    public boolean unsubscribe(Subscription subscription) {
        return eventBus.unsubscribe(subscription);
    }

    public List<BridgeEvent> pendingEvents(EntrySource target, int limit) {
        return eventBus.pending(target, limit);
    }

    public boolean markEventProcessed(String eventId) {
        return eventBus.markProcessed(eventId);
    }

    // --- Maintenance ---

    /**
     * @return number of durable entries removed
     */
    public int sweep(RetentionPolicy policy) {
        return store.sweep(policy);
    }

    /**
     * @return number of expired in-process cache entries removed
     */
    public int purgeExpiredCache() {
        return cache.purgeExpired();
    }

    public MemoryStats stats() {
        long hits = cacheHits.sum();
        long misses = cacheMisses.sum();
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
        double missRate = lookups == 0 ? 0.0 : (double) misses / lookups;

        Map<EntryCategory, Long> counts;
        try {
            counts = store.counts();
        } catch (StoreException e) {
            log.warn("Could not count durable entries: {}", e.getMessage());
            counts = Map.of();
        }
        return new MemoryStats(hitRate, missRate, cache.isDegraded(), counts, cache.stats());
    }

    public boolean healthCheck() {
        return !closed.get() && store.healthCheck();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            cache.close();
        } finally {
            store.close();
        }
        log.info("Unified memory closed");
    }
}
