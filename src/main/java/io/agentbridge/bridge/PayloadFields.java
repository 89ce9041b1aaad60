package io.agentbridge.bridge;

import io.agentbridge.memory.MemoryEntry;
import io.agentbridge.memory.PayloadValues;

import java.util.List;
import java.util.Map;

/**
 * Typed access to decoded payload fields. JSON numbers come back as whichever
 * {@link Number} subtype fits, so numeric fields are read through {@code Number}.
 */
final class PayloadFields {

    private PayloadFields() {
    }

    static String string(MemoryEntry entry, String field) {
        Object value = entry.payload().get(field);
        return value == null ? null : value.toString();
    }

    static String requireString(MemoryEntry entry, String field) {
        String value = string(entry, field);
        if (value == null) {
            throw new IllegalArgumentException("Entry " + entry.key() + " has no '" + field + "' field");
        }
        return value;
    }

    static Number number(MemoryEntry entry, String field) {
        Object value = entry.payload().get(field);
        if (value instanceof Number number) {
            return number;
        }
        throw new IllegalArgumentException("Entry " + entry.key() + " field '" + field + "' is not numeric: " + value);
    }

    static Map<String, Object> map(MemoryEntry entry, String field) {
        Object value = entry.payload().get(field);
        return value instanceof Map<?, ?> map ? PayloadValues.canonicalMap(map) : Map.of();
    }

    static List<?> list(MemoryEntry entry, String field) {
        Object value = entry.payload().get(field);
        return value instanceof List<?> list ? list : List.of();
    }

    static void requireType(MemoryEntry entry, String expected) {
        Object type = entry.payload().get("type");
        if (!expected.equals(type)) {
            throw new IllegalArgumentException("Entry " + entry.key() + " is not a " + expected + ": " + type);
        }
    }
}
