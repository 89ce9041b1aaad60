package io.agentbridge.memory;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

class EntryCategoryTest {

    @Test
    void shouldParseAllSpellings() {
        assertEquals(EntryCategory.MARKET_DATA, EntryCategory.fromString("MarketData"));
        assertEquals(EntryCategory.MARKET_DATA, EntryCategory.fromString("market_data"));
        assertEquals(EntryCategory.MARKET_DATA, EntryCategory.fromString("MARKET_DATA"));
        assertEquals(EntryCategory.AGENT_DECISION, EntryCategory.fromString("agent_decisions"));
        assertEquals(EntryCategory.TRADING_SIGNAL, EntryCategory.fromString("TradingSignal"));
        assertEquals(EntryCategory.SYSTEM_STATE, EntryCategory.fromString("system-state"));
        assertEquals(EntryCategory.EVENT, EntryCategory.fromString("events"));
    }

    @Test
    void shouldRejectUnknownCategory() {
        assertThrows(IllegalArgumentException.class, () -> EntryCategory.fromString("orders"));
        assertThrows(IllegalArgumentException.class, () -> EntryCategory.fromString(""));
        assertThrows(IllegalArgumentException.class, () -> EntryCategory.fromString(null));
    }

    @Test
    void tablesAndSegmentsShouldBeDistinct() {
        var tables = new HashSet<String>();
        var segments = new HashSet<String>();
        Arrays.stream(EntryCategory.values()).forEach(c -> {
            tables.add(c.tableName());
            segments.add(c.cacheSegment());
        });
        assertEquals(EntryCategory.values().length, tables.size());
        assertEquals(EntryCategory.values().length, segments.size());
        assertEquals("agent_decisions", EntryCategory.AGENT_DECISION.tableName());
    }

    @Test
    void sourceShouldDefaultToShared() {
        assertEquals(EntrySource.AI_FRAMEWORK, EntrySource.fromString("crewai"));
        assertEquals(EntrySource.TRADING_FRAMEWORK, EntrySource.fromString("trading-framework"));
        assertEquals(EntrySource.SHARED, EntrySource.fromString(null));
        assertEquals(EntrySource.SHARED, EntrySource.fromString("whatever"));
    }
}
