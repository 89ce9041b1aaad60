package io.agentbridge.bridge;

/**
 * An aggregated price bar as produced by the trading subsystem.
 *
 * @param tsEvent event time in nanoseconds since the epoch
 */
public record MarketBar(
        String instrumentId,
        String barType,
        double open,
        double high,
        double low,
        double close,
        double volume,
        long tsEvent
) {
}
