package io.agentbridge.memory;

/**
 * Write policy chosen by the producer for a single write.
 */
public enum MemoryType {
    /** Ephemeral; lost on restart or eviction. */
    CACHE_ONLY,
    /** Durable store only. */
    PERSISTENT_ONLY,
    /** Cache (best effort) and durable store (authoritative). */
    BOTH;

    public boolean usesCache() {
        return this != PERSISTENT_ONLY;
    }

    public boolean usesStore() {
        return this != CACHE_ONLY;
    }
}
