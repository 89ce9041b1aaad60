package io.agentbridge.memory;

/**
 * Categories of shared entries. Each category maps to its own durable table
 * and its own cache key segment.
 *
 * <ul>
 *   <li>{@code MARKET_DATA}: bars, ticks and other market observations.</li>
 *   <li>{@code AGENT_DECISION}: decisions produced by AI agents.</li>
 *   <li>{@code TRADING_SIGNAL}: actionable signals consumed by the trading side.</li>
 *   <li>{@code SYSTEM_STATE}: health and status of components.</li>
 *   <li>{@code EVENT}: audit log of published cross-subsystem events.</li>
 * </ul>
 */
public enum EntryCategory {
    MARKET_DATA("market_data", "market"),
    AGENT_DECISION("agent_decisions", "agent"),
    TRADING_SIGNAL("trading_signals", "signal"),
    SYSTEM_STATE("system_state", "state"),
    EVENT("events", "event");

    private final String tableName;
    private final String cacheSegment;

    EntryCategory(String tableName, String cacheSegment) {
        this.tableName = tableName;
        this.cacheSegment = cacheSegment;
    }

    public String tableName() {
        return tableName;
    }

    public String cacheSegment() {
        return cacheSegment;
    }

    /**
     * Parses a category name. Accepts enum names, table names and the camel-case
     * spelling ({@code MarketData}) regardless of case.
     *
     * @throws IllegalArgumentException if the value names no category
     */
    public static EntryCategory fromString(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Category must not be blank");
        }
        String normalized = s.trim().replace("_", "").replace("-", "").toLowerCase();
        return switch (normalized) {
            case "marketdata", "market" -> MARKET_DATA;
            case "agentdecision", "agentdecisions", "agent" -> AGENT_DECISION;
            case "tradingsignal", "tradingsignals", "signal" -> TRADING_SIGNAL;
            case "systemstate", "state" -> SYSTEM_STATE;
            case "event", "events" -> EVENT;
            default -> throw new IllegalArgumentException("Unknown category: " + s);
        };
    }
}
