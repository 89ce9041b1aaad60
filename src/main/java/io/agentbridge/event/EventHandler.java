package io.agentbridge.event;

/**
 * Receives published events. Invoked synchronously on the publisher's thread.
 */
@FunctionalInterface
public interface EventHandler {

    void onEvent(BridgeEvent event);
}
