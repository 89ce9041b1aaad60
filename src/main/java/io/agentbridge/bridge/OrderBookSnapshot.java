package io.agentbridge.bridge;

import java.util.List;

/**
 * Order book state as produced by the trading subsystem.
 *
 * @param bids    best bid first
 * @param asks    best ask first
 * @param tsEvent event time in nanoseconds since the epoch
 */
public record OrderBookSnapshot(
        String instrumentId,
        List<BookLevel> bids,
        List<BookLevel> asks,
        long tsEvent
) {
    public OrderBookSnapshot {
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }
}
