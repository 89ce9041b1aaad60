package io.agentbridge.bridge;

/**
 * One price level of an order book side.
 */
public record BookLevel(double price, double size) {
}
