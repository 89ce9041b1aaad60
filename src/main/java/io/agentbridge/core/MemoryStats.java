package io.agentbridge.core;

import io.agentbridge.cache.CacheStats;
import io.agentbridge.memory.EntryCategory;

import java.util.Map;

/**
 * Health snapshot of the memory system.
 *
 * @param hitRate                fraction of cache lookups that found the entry
 * @param missRate               fraction of cache lookups that did not
 * @param degraded               true while the cache backend is down
 * @param entryCountsByCategory  durable entries per category
 * @param cache                  cache tier counters
 */
public record MemoryStats(
        double hitRate,
        double missRate,
        boolean degraded,
        Map<EntryCategory, Long> entryCountsByCategory,
        CacheStats cache
) {
    public MemoryStats {
        entryCountsByCategory = entryCountsByCategory == null ? Map.of() : Map.copyOf(entryCountsByCategory);
    }
}
