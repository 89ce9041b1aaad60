package io.agentbridge.memory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical form of payload values, shared by every tier.
 *
 * <p>JSON does not keep Java's numeric widths, so integral numbers are held as {@code Long}
 * and {@code Float} as {@code Double}; nested maps and collections are copied the same way.
 * A payload read back from the cache or the durable store is then equal to the one written.</p>
 */
public final class PayloadValues {

    private PayloadValues() {
    }

    /**
     * Unmodifiable copy with string keys and canonical values. Null values are kept.
     */
    public static Map<String, Object> canonicalMap(Map<?, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : source.entrySet()) {
            copy.put(String.valueOf(e.getKey()), canonical(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    static Object canonical(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return Double.parseDouble(f.toString());
        }
        if (value instanceof Map<?, ?> map) {
            return canonicalMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object element : collection) {
                list.add(canonical(element));
            }
            return Collections.unmodifiableList(list);
        }
        return value;
    }
}
