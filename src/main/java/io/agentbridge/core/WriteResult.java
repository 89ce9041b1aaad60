package io.agentbridge.core;

import io.agentbridge.memory.MemoryEntry;

/**
 * Outcome of {@link UnifiedMemory#write}.
 *
 * @param status outcome
 * @param entry  the entry as written, with {@code createdAt} stamped
 * @param detail human-readable explanation, null when there is nothing to report
 */
public record WriteResult(Status status, MemoryEntry entry, String detail) {

    public enum Status {
        /** Every required tier accepted the write. */
        OK,
        /** The durable write succeeded but the cache backend was unavailable. The write is committed. */
        PARTIAL_FAILURE,
        /** The durable write failed. The data is not persisted. */
        FAILURE
    }

    public static WriteResult ok(MemoryEntry entry) {
        return new WriteResult(Status.OK, entry, null);
    }

    public static WriteResult ok(MemoryEntry entry, String detail) {
        return new WriteResult(Status.OK, entry, detail);
    }

    public static WriteResult partialFailure(MemoryEntry entry, String detail) {
        return new WriteResult(Status.PARTIAL_FAILURE, entry, detail);
    }

    public static WriteResult failure(MemoryEntry entry, String detail) {
        return new WriteResult(Status.FAILURE, entry, detail);
    }

    /**
     * True unless the write failed; callers may treat a partial failure as success.
     */
    public boolean isCommitted() {
        return status != Status.FAILURE;
    }
}
