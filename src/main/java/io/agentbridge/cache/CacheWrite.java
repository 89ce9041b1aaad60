package io.agentbridge.cache;

/**
 * Where a cache write landed.
 */
public enum CacheWrite {
    /** Stored by the primary backend. */
    PRIMARY,
    /** The primary backend was unavailable; stored in the in-process fallback. */
    FALLBACK
}
