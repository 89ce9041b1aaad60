package io.agentbridge.cache;

import io.agentbridge.memory.EntryCategory;

import java.time.Duration;
import java.util.Optional;

/**
 * Fast, non-durable key-value storage for serialized entries, partitioned by category.
 * Never throws because a backend is unreachable: operations fall back to an in-process map.
 */
public interface VolatileCache extends AutoCloseable {

    /**
     * Stores a serialized entry.
     *
     * @param durableCopy whether the durable store also holds the entry
     * @return where the value landed
     */
    CacheWrite set(EntryCategory category, String key, String value, Duration ttl, boolean durableCopy);

    Optional<String> get(EntryCategory category, String key);

    void delete(EntryCategory category, String key);

    /**
     * True while the primary backend is considered down and the in-process fallback serves requests.
     */
    boolean isDegraded();

    /**
     * Returns true exactly once per degraded window, the first time it is called after the
     * primary backend went down.
     */
    boolean consumeDegradedNotice();

    /**
     * Removes expired entries from the in-process map.
     *
     * @return number of removed entries
     */
    int purgeExpired();

    CacheStats stats();

    @Override
    void close();
}
