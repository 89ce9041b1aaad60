package io.agentbridge.bridge;

import io.agentbridge.memory.EntrySource;
import io.agentbridge.memory.MemoryEntry;

import java.time.Instant;
import java.util.Map;

/**
 * A stored trading signal as read back from shared memory.
 */
public record TradingSignal(String signalId, Map<String, Object> data, EntrySource source, Instant createdAt) {

    static TradingSignal fromEntry(MemoryEntry entry) {
        return new TradingSignal(entry.key(), entry.payload(), entry.source(), entry.createdAt());
    }
}
