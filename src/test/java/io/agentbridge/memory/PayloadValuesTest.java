package io.agentbridge.memory;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadValuesTest {

    @Test
    void shouldWidenIntegralNumbersToLong() {
        Map<String, Object> payload = PayloadValues.canonicalMap(Map.of("qty", 5, "lots", (short) 2, "id", 7L));

        assertEquals(5L, payload.get("qty"));
        assertEquals(2L, payload.get("lots"));
        assertEquals(7L, payload.get("id"));
    }

    @Test
    void shouldKeepFloatDecimalDigits() {
        assertEquals(0.1, PayloadValues.canonicalMap(Map.of("px", 0.1f)).get("px"));
    }

    @Test
    void shouldNormalizeNestedStructures() {
        Map<String, Object> level = new HashMap<>();
        level.put("size", 3);
        List<Object> levels = new ArrayList<>();
        levels.add(level);
        levels.add(null);

        Map<String, Object> payload = PayloadValues.canonicalMap(Map.of("bids", levels));

        List<?> bids = (List<?>) payload.get("bids");
        assertEquals(Map.of("size", 3L), bids.get(0));
        assertNull(bids.get(1));
        assertThrows(UnsupportedOperationException.class, () -> payload.put("x", 1));
    }

    @Test
    void shouldStringifyKeys() {
        Map<Object, Object> source = new HashMap<>();
        source.put(1, "one");

        assertEquals("one", PayloadValues.canonicalMap(source).get("1"));
        assertTrue(PayloadValues.canonicalMap(null).isEmpty());
    }
}
