package io.agentbridge.bridge;

import io.agentbridge.memory.EntryCategory;
import io.agentbridge.memory.EntrySource;
import io.agentbridge.memory.MemoryEntry;
import io.agentbridge.memory.MemoryType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bars are kept in cache and durable store under {@code {instrument}:bar:{ts_event}}.
 */
public class MarketBarAdapter implements BridgeAdapter<MarketBar> {

    static final String TYPE = "bar";

    @Override
    public MemoryEntry toEntry(MarketBar bar, EntryCategory category) {
        if (!supports(category)) {
            throw new IllegalArgumentException("Bars cannot be stored as " + category);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("instrument_id", bar.instrumentId());
        payload.put("type", TYPE);
        payload.put("timestamp", bar.tsEvent());
        payload.put("open", bar.open());
        payload.put("high", bar.high());
        payload.put("low", bar.low());
        payload.put("close", bar.close());
        payload.put("volume", bar.volume());
        payload.put("bar_type", bar.barType());

        return MemoryEntry.of(category, EntryKeys.of(bar.instrumentId(), TYPE, bar.tsEvent()), payload,
                EntrySource.TRADING_FRAMEWORK, MemoryType.BOTH);
    }

    @Override
    public MarketBar fromEntry(MemoryEntry entry) {
        PayloadFields.requireType(entry, TYPE);
        return new MarketBar(
                PayloadFields.requireString(entry, "instrument_id"),
                PayloadFields.string(entry, "bar_type"),
                PayloadFields.number(entry, "open").doubleValue(),
                PayloadFields.number(entry, "high").doubleValue(),
                PayloadFields.number(entry, "low").doubleValue(),
                PayloadFields.number(entry, "close").doubleValue(),
                PayloadFields.number(entry, "volume").doubleValue(),
                PayloadFields.number(entry, "timestamp").longValue()
        );
    }

    @Override
    public boolean supports(EntryCategory category) {
        return category == EntryCategory.MARKET_DATA;
    }
}
