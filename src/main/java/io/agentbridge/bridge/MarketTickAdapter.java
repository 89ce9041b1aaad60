package io.agentbridge.bridge;

import io.agentbridge.memory.EntryCategory;
import io.agentbridge.memory.EntrySource;
import io.agentbridge.memory.MemoryEntry;
import io.agentbridge.memory.MemoryType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ticks are high-frequency and cache-only, keyed {@code {instrument}:tick:{ts_event}}.
 */
public class MarketTickAdapter implements BridgeAdapter<MarketTick> {

    static final String TYPE = "tick";

    @Override
    public MemoryEntry toEntry(MarketTick tick, EntryCategory category) {
        if (!supports(category)) {
            throw new IllegalArgumentException("Ticks cannot be stored as " + category);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("instrument_id", tick.instrumentId());
        payload.put("type", TYPE);
        payload.put("timestamp", tick.tsEvent());
        payload.put("price", tick.price());
        payload.put("size", tick.size());
        payload.put("aggressor_side", tick.aggressorSide());
        payload.put("trade_id", tick.tradeId());

        return MemoryEntry.of(category, EntryKeys.of(tick.instrumentId(), TYPE, tick.tsEvent()), payload,
                EntrySource.TRADING_FRAMEWORK, MemoryType.CACHE_ONLY);
    }

    @Override
    public MarketTick fromEntry(MemoryEntry entry) {
        PayloadFields.requireType(entry, TYPE);
        return new MarketTick(
                PayloadFields.requireString(entry, "instrument_id"),
                PayloadFields.number(entry, "price").doubleValue(),
                PayloadFields.number(entry, "size").doubleValue(),
                PayloadFields.string(entry, "aggressor_side"),
                PayloadFields.string(entry, "trade_id"),
                PayloadFields.number(entry, "timestamp").longValue()
        );
    }

    @Override
    public boolean supports(EntryCategory category) {
        return category == EntryCategory.MARKET_DATA;
    }
}
