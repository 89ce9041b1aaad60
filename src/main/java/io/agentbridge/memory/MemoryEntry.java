package io.agentbridge.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * The unit of data shared between the AI and trading subsystems.
 *
 * @param category   which table / cache segment the entry belongs to
 * @param key        unique within the category, e.g. {@code EURUSD:bar:1}
 * @param payload    structured content, held in the canonical form of {@link PayloadValues}
 * @param source     side that produced the entry
 * @param memoryType write policy for this entry
 * @param createdAt  set at write time by the memory system
 * @param ttl        cache expiry, null for the category default; never applied to durable copies
 * @param confidence optional score in [0,1] for decisions and signals
 */
public record MemoryEntry(
        EntryCategory category,
        String key,
        Map<String, Object> payload,
        EntrySource source,
        MemoryType memoryType,
        Instant createdAt,
        Duration ttl,
        Double confidence
) {
    public MemoryEntry {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(memoryType, "memoryType");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Entry key must not be blank");
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence must be within [0,1]: " + confidence);
        }
        payload = PayloadValues.canonicalMap(payload);
    }

    /**
     * Creates an entry without timestamp, TTL or confidence.
     */
    public static MemoryEntry of(EntryCategory category, String key, Map<String, Object> payload,
                                 EntrySource source, MemoryType memoryType) {
        return new MemoryEntry(category, key, payload, source, memoryType, null, null, null);
    }

    public MemoryEntry withCreatedAt(Instant createdAt) {
        return new MemoryEntry(category, key, payload, source, memoryType, createdAt, ttl, confidence);
    }

    public MemoryEntry withTtl(Duration ttl) {
        return new MemoryEntry(category, key, payload, source, memoryType, createdAt, ttl, confidence);
    }

    public MemoryEntry withConfidence(Double confidence) {
        return new MemoryEntry(category, key, payload, source, memoryType, createdAt, ttl, confidence);
    }

    public MemoryEntry withMemoryType(MemoryType memoryType) {
        return new MemoryEntry(category, key, payload, source, memoryType, createdAt, ttl, confidence);
    }
}
