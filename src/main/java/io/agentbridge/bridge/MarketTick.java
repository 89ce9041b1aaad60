package io.agentbridge.bridge;

/**
 * A single trade tick as produced by the trading subsystem.
 *
 * @param aggressorSide BUYER, SELLER or NO_AGGRESSOR
 * @param tsEvent       event time in nanoseconds since the epoch
 */
public record MarketTick(
        String instrumentId,
        double price,
        double size,
        String aggressorSide,
        String tradeId,
        long tsEvent
) {
}
