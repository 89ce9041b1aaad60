package io.agentbridge.memory;

/**
 * Which side produced an entry or an event. Also used as the target of an event.
 */
public enum EntrySource {
    AI_FRAMEWORK,
    TRADING_FRAMEWORK,
    SHARED;

    public static EntrySource fromString(String s) {
        if (s == null || s.isBlank()) return SHARED;
        return switch (s.trim().replace("-", "_").toLowerCase()) {
            case "ai_framework", "aiframework", "ai", "crewai" -> AI_FRAMEWORK;
            case "trading_framework", "tradingframework", "trading", "nautilus" -> TRADING_FRAMEWORK;
            default -> SHARED;
        };
    }
}
