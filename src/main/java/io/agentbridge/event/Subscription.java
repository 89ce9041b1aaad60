package io.agentbridge.event;

import io.agentbridge.memory.EntrySource;

/**
 * A registered handler and the filter it was registered with.
 *
 * @param id        handle for {@link EventBus#unsubscribe}
 * @param eventType only events of this type, or null for every type
 * @param target    only events addressed to this side (or broadcast), or null for every target
 * @param handler   the callback
 */
public record Subscription(String id, String eventType, EntrySource target, EventHandler handler) {

    boolean matches(BridgeEvent event) {
        if (eventType != null && !eventType.equals(event.eventType())) {
            return false;
        }
        return target == null || event.target() == null || target == event.target();
    }
}
