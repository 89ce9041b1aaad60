package io.agentbridge.cache;

/**
 * Snapshot of the cache tier.
 *
 * @param backend      name of the primary backend
 * @param state        circuit state of the primary backend (CLOSED, OPEN, HALF_OPEN, LOCAL)
 * @param degraded     true while operations are served by the in-process fallback
 * @param localEntries entries held in the in-process cache
 * @param evictions    in-process entries evicted that still had a durable copy
 * @param drops        in-process entries evicted that existed only in the cache
 * @param expirations  in-process entries removed because their TTL passed
 * @param fallbacks    operations served by the fallback because the primary failed
 */
public record CacheStats(
        String backend,
        String state,
        boolean degraded,
        int localEntries,
        long evictions,
        long drops,
        long expirations,
        long fallbacks
) {
}
