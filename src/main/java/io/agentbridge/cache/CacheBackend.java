package io.agentbridge.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value service with per-entry expiration ({@code SET key value PX ttl}, {@code GET}, {@code DEL}).
 * Implemented by the external Redis backend and by the in-process fallback.
 */
public interface CacheBackend extends AutoCloseable {

    /**
     * Stores a value.
     *
     * @param key         namespaced cache key
     * @param value       serialized entry
     * @param ttl         expiry, or null to keep until evicted
     * @param durableCopy whether the durable store also holds this value
     * @throws CacheUnavailableException if the backend cannot be reached
     */
    void set(String key, String value, Duration ttl, boolean durableCopy);

    /**
     * @return the value, or empty on a miss
     * @throws CacheUnavailableException if the backend cannot be reached
     */
    Optional<String> get(String key);

    /**
     * @throws CacheUnavailableException if the backend cannot be reached
     */
    void delete(String key);

    /**
     * Returns true if the backend answers.
     */
    boolean ping();

    /**
     * Display name used in logs and stats.
     */
    String name();

    @Override
    void close();
}
