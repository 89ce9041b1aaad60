package io.agentbridge.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-process cache with per-entry expiry, used when no external backend is
 * configured or reachable.
 *
 * <p>Expired entries are removed lazily on read and by {@link #purgeExpired()}.
 * When the capacity is exceeded the cache evicts, in order: expired entries, the
 * least recently used entry that still has a durable copy, and finally the least
 * recently used cache-only entry. The last case loses data and is counted as a drop.</p>
 *
 * <p>Thread-safe: all access is synchronized on the instance.</p>
 */
public class InMemoryCache implements CacheBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCache.class);

    private final int maxEntries;
    private final Clock clock;
    private final LinkedHashMap<String, Slot> slots = new LinkedHashMap<>(16, 0.75f, true);

    private long evictions;
    private long drops;
    private long expirations;

    public InMemoryCache(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public InMemoryCache(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl, boolean durableCopy) {
        long expiresAt = ttl == null ? Long.MAX_VALUE : clock.millis() + ttl.toMillis();
        slots.put(key, new Slot(value, expiresAt, durableCopy));
        if (slots.size() > maxEntries) {
            makeRoom(key);
        }
    }

    @Override
    public synchronized Optional<String> get(String key) {
        Slot slot = slots.get(key);
        if (slot == null) {
            return Optional.empty();
        }
        if (slot.isExpired(clock.millis())) {
            slots.remove(key);
            expirations++;
            return Optional.empty();
        }
        return Optional.of(slot.value());
    }

    @Override
    public synchronized void delete(String key) {
        slots.remove(key);
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public String name() {
        return "in-memory";
    }

    /**
     * Removes every expired entry.
     *
     * @return number of removed entries
     */
    public synchronized int purgeExpired() {
        long now = clock.millis();
        int removed = 0;
        Iterator<Slot> it = slots.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        expirations += removed;
        if (removed > 0) {
            log.debug("Purged {} expired cache entries", removed);
        }
        return removed;
    }

    public synchronized int size() {
        return slots.size();
    }

    public synchronized long evictions() {
        return evictions;
    }

    public synchronized long drops() {
        return drops;
    }

    public synchronized long expirations() {
        return expirations;
    }

    @Override
    public synchronized void close() {
        slots.clear();
    }

    private void makeRoom(String newestKey) {
        purgeExpired();
        while (slots.size() > maxEntries) {
            if (!evictRecoverable(newestKey)) {
                Iterator<Map.Entry<String, Slot>> it = slots.entrySet().iterator();
                Map.Entry<String, Slot> eldest = it.next();
                it.remove();
                drops++;
                log.warn("In-process cache full ({} entries), dropped cache-only entry '{}'", maxEntries, eldest.getKey());
            }
        }
    }

    private boolean evictRecoverable(String newestKey) {
        Iterator<Map.Entry<String, Slot>> it = slots.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Slot> candidate = it.next();
            if (candidate.getValue().durableCopy() && !candidate.getKey().equals(newestKey)) {
                it.remove();
                evictions++;
                return true;
            }
        }
        return false;
    }

    private record Slot(String value, long expiresAt, boolean durableCopy) {
        boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}
