package io.agentbridge.event;

import io.agentbridge.memory.DurableStore;
import io.agentbridge.memory.EntrySource;
import io.agentbridge.memory.MemoryEntry;
import io.agentbridge.memory.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process publish/subscribe between the AI and trading subsystems, backed by the
 * durable event log.
 *
 * <p>Every published event is appended to the log before any handler runs, so a consumer
 * that was not listening can pick it up later through {@link #pending}. Handlers are called
 * synchronously in registration order; a failing handler is logged and does not affect the
 * others or the publisher.</p>
 *
 * <p>Thread-safe: handlers can be subscribed and unsubscribed from any thread.</p>
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final DurableStore store;
    private final Clock clock;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public EventBus(DurableStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Persists the event and delivers it to every matching handler.
     *
     * @return the event with its id and timestamp assigned
     * @throws StoreException if the event could not be logged; no handler is invoked in that case
     */
    public BridgeEvent publish(BridgeEvent event) {
        BridgeEvent stamped = event.stamped(
                "evt-" + UUID.randomUUID(),
                clock.instant().truncatedTo(ChronoUnit.MILLIS));

        store.put(stamped.toEntry());
        log.debug("Event published: {} ({}) {} -> {}", stamped.eventType(), stamped.id(), stamped.source(),
                stamped.isBroadcast() ? "all" : stamped.target());

        for (Subscription subscription : subscriptions) {
            if (!subscription.matches(stamped)) {
                continue;
            }
            try {
                subscription.handler().onEvent(stamped);
            } catch (RuntimeException e) {
                log.error("Event handler {} failed on {} ({})", subscription.id(), stamped.eventType(), stamped.id(), e);
            }
        }
        return stamped;
    }

    /**
     * Subscribes to one event type, whatever its target.
     */
    public Subscription subscribe(String eventType, EventHandler handler) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        return register(new Subscription(newId(), eventType, null, handler));
    }

    /**
     * Subscribes to every event addressed to the given side, plus broadcasts.
     */
    public Subscription subscribe(EntrySource target, EventHandler handler) {
        if (target == null) {
            throw new IllegalArgumentException("Target must not be null");
        }
        return register(new Subscription(newId(), null, target, handler));
    }

    /**
     * Subscribes to events of one type addressed to the given side, plus broadcasts of that type.
     */
    public Subscription subscribe(String eventType, EntrySource target, EventHandler handler) {
        return register(new Subscription(newId(), eventType, target, handler));
    }

    public Subscription subscribeAll(EventHandler handler) {
        return register(new Subscription(newId(), null, null, handler));
    }

    /**
     * @return true if the subscription was registered
     */
    public boolean unsubscribe(Subscription subscription) {
        boolean removed = subscriptions.remove(subscription);
        if (removed) {
            log.info("Event handler unsubscribed: {}", subscription.id());
        }
        return removed;
    }

    /**
     * Unprocessed events addressed to the target or broadcast, oldest first.
     */
    public List<BridgeEvent> pending(EntrySource target, int limit) {
        List<MemoryEntry> entries = store.pendingEvents(target, limit);
        return entries.stream().map(BridgeEvent::fromEntry).toList();
    }

    /**
     * @return true if the event exists
     */
    public boolean markProcessed(String eventId) {
        return store.markEventProcessed(eventId);
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    private Subscription register(Subscription subscription) {
        if (subscription.handler() == null) {
            throw new IllegalArgumentException("Handler must not be null");
        }
        subscriptions.add(subscription);
        log.info("Event handler subscribed: {} (type={}, target={})", subscription.id(),
                subscription.eventType() == null ? "*" : subscription.eventType(),
                subscription.target() == null ? "*" : subscription.target());
        return subscription;
    }

    private static String newId() {
        return "sub-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
