package io.agentbridge.bridge;

import io.agentbridge.memory.EntryCategory;
import io.agentbridge.memory.EntrySource;
import io.agentbridge.memory.MemoryEntry;
import io.agentbridge.memory.MemoryType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Order books are cache-only, keyed {@code {instrument}:orderbook:{ts_event}}. Only the
 * top {@value #DEPTH} levels of each side are kept, along with the best prices and the spread
 * when both sides are quoted.
 */
public class OrderBookAdapter implements BridgeAdapter<OrderBookSnapshot> {

    static final String TYPE = "orderbook";
    static final int DEPTH = 10;

    @Override
    public MemoryEntry toEntry(OrderBookSnapshot book, EntryCategory category) {
        if (!supports(category)) {
            throw new IllegalArgumentException("Order books cannot be stored as " + category);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("instrument_id", book.instrumentId());
        payload.put("type", TYPE);
        payload.put("timestamp", book.tsEvent());
        payload.put("bids", levels(book.bids()));
        payload.put("asks", levels(book.asks()));
        if (!book.bids().isEmpty()) {
            payload.put("bid_price", book.bids().get(0).price());
        }
        if (!book.asks().isEmpty()) {
            payload.put("ask_price", book.asks().get(0).price());
        }
        if (!book.bids().isEmpty() && !book.asks().isEmpty()) {
            payload.put("spread", book.asks().get(0).price() - book.bids().get(0).price());
        }

        return MemoryEntry.of(category, EntryKeys.of(book.instrumentId(), TYPE, book.tsEvent()), payload,
                EntrySource.TRADING_FRAMEWORK, MemoryType.CACHE_ONLY);
    }

    @Override
    public OrderBookSnapshot fromEntry(MemoryEntry entry) {
        PayloadFields.requireType(entry, TYPE);
        return new OrderBookSnapshot(
                PayloadFields.requireString(entry, "instrument_id"),
                toLevels(entry, "bids"),
                toLevels(entry, "asks"),
                PayloadFields.number(entry, "timestamp").longValue()
        );
    }

    @Override
    public boolean supports(EntryCategory category) {
        return category == EntryCategory.MARKET_DATA;
    }

    private static List<Map<String, Object>> levels(List<BookLevel> side) {
        List<Map<String, Object>> levels = new ArrayList<>();
        for (BookLevel level : side.subList(0, Math.min(DEPTH, side.size()))) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("price", level.price());
            row.put("size", level.size());
            levels.add(row);
        }
        return levels;
    }

    private static List<BookLevel> toLevels(MemoryEntry entry, String field) {
        List<BookLevel> levels = new ArrayList<>();
        for (Object row : PayloadFields.list(entry, field)) {
            if (!(row instanceof Map<?, ?> level)
                    || !(level.get("price") instanceof Number price)
                    || !(level.get("size") instanceof Number size)) {
                throw new IllegalArgumentException("Entry " + entry.key() + " has a malformed " + field + " level: " + row);
            }
            levels.add(new BookLevel(price.doubleValue(), size.doubleValue()));
        }
        return levels;
    }
}
