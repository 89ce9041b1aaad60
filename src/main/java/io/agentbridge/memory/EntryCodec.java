package io.agentbridge.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding of payloads (durable column) and of whole entries (cache value).
 *
 * <p>Payload keys are written in sorted order so the same payload always yields the
 * same bytes. Integral JSON numbers are read as {@code Long}, matching {@link PayloadValues}.</p>
 */
public class EntryCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public EntryCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.USE_LONG_FOR_INTS, true);
    }

    public EntryCodec() {
        this(new ObjectMapper());
    }

    public String encodePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Object> decodePayload(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Corrupt payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Encodes a complete entry, including its metadata, for the cache tier.
     */
    public String encodeEntry(MemoryEntry entry) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("category", entry.category().name());
        doc.put("key", entry.key());
        doc.put("payload", entry.payload());
        doc.put("source", entry.source().name());
        doc.put("memory_type", entry.memoryType().name());
        doc.put("created_at", entry.createdAt() == null ? null : entry.createdAt().toEpochMilli());
        doc.put("ttl_ms", entry.ttl() == null ? null : entry.ttl().toMillis());
        doc.put("confidence", entry.confidence());
        return encodePayload(doc);
    }

    public MemoryEntry decodeEntry(String json) {
        Map<String, Object> doc = decodePayload(json);
        Object payload = doc.get("payload");
        Number createdAt = (Number) doc.get("created_at");
        Number ttlMillis = (Number) doc.get("ttl_ms");
        Number confidence = (Number) doc.get("confidence");
        return new MemoryEntry(
                EntryCategory.valueOf((String) doc.get("category")),
                (String) doc.get("key"),
                payload instanceof Map<?, ?> map ? PayloadValues.canonicalMap(map) : Map.of(),
                EntrySource.valueOf((String) doc.get("source")),
                MemoryType.valueOf((String) doc.get("memory_type")),
                createdAt == null ? null : Instant.ofEpochMilli(createdAt.longValue()),
                ttlMillis == null ? null : Duration.ofMillis(ttlMillis.longValue()),
                confidence == null ? null : confidence.doubleValue()
        );
    }
}
