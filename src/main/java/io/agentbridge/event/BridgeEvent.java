package io.agentbridge.event;

import io.agentbridge.memory.DurableStore;
import io.agentbridge.memory.EntryCategory;
import io.agentbridge.memory.EntrySource;
import io.agentbridge.memory.MemoryEntry;
import io.agentbridge.memory.MemoryType;
import io.agentbridge.memory.PayloadValues;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A typed notification from one subsystem to the other.
 *
 * @param id        unique id, also the key of the event in the durable log
 * @param eventType e.g. {@code market_bar_received}
 * @param eventData structured content
 * @param source    publishing side
 * @param target    intended consumer, or null for broadcast
 * @param createdAt publication time
 * @param processed whether a consumer has acknowledged the event
 */
public record BridgeEvent(
        String id,
        String eventType,
        Map<String, Object> eventData,
        EntrySource source,
        EntrySource target,
        Instant createdAt,
        boolean processed
) {
    static final String EVENT_TYPE = "event_type";
    static final String EVENT_DATA = "event_data";
    static final String TARGET = "target";
    static final String PROCESSED = "processed";

    public BridgeEvent {
        Objects.requireNonNull(source, "source");
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        eventData = PayloadValues.canonicalMap(eventData);
    }

    /**
     * Creates an unpublished event; id and timestamp are assigned by {@link EventBus#publish}.
     */
    public static BridgeEvent of(String eventType, Map<String, Object> eventData,
                                 EntrySource source, EntrySource target) {
        return new BridgeEvent(null, eventType, eventData, source, target, null, false);
    }

    public boolean isBroadcast() {
        return target == null;
    }

    BridgeEvent stamped(String id, Instant createdAt) {
        return new BridgeEvent(id, eventType, eventData, source, target, createdAt, processed);
    }

    /**
     * Durable form of this event: an {@link EntryCategory#EVENT} entry keyed by the event id.
     */
    public MemoryEntry toEntry() {
        if (id == null) {
            throw new IllegalStateException("Event has not been published: " + eventType);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EVENT_TYPE, eventType);
        payload.put(EVENT_DATA, eventData);
        payload.put(TARGET, target == null ? null : target.name());
        payload.put(PROCESSED, processed);
        return new MemoryEntry(EntryCategory.EVENT, id, payload, source, MemoryType.PERSISTENT_ONLY,
                createdAt, null, null);
    }

    public static BridgeEvent fromEntry(MemoryEntry entry) {
        if (entry.category() != EntryCategory.EVENT) {
            throw new IllegalArgumentException("Not an event entry: " + entry.category());
        }
        Map<String, Object> payload = entry.payload();
        Object data = payload.get(EVENT_DATA);
        Object target = payload.get(TARGET);
        return new BridgeEvent(
                entry.key(),
                String.valueOf(payload.getOrDefault(EVENT_TYPE, DurableStore.DEFAULT_EVENT_TYPE)),
                data instanceof Map<?, ?> map ? PayloadValues.canonicalMap(map) : Map.of(),
                entry.source(),
                target == null ? null : EntrySource.valueOf(target.toString()),
                entry.createdAt(),
                Boolean.TRUE.equals(payload.get(PROCESSED))
        );
    }
}
