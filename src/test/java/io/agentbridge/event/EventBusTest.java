package io.agentbridge.event;

import io.agentbridge.memory.DurableStore;
import io.agentbridge.memory.EntryCategory;
import io.agentbridge.memory.EntryCodec;
import io.agentbridge.memory.EntrySource;
import io.agentbridge.memory.MemoryEntry;
import io.agentbridge.memory.SQLiteDurableStore;
import io.agentbridge.memory.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class EventBusTest {

    @TempDir
    Path tempDir;

    private SQLiteDurableStore store;
    private EventBus bus;

    @BeforeEach
    void setUp() {
        store = new SQLiteDurableStore(tempDir.resolve("events.db").toString(), new EntryCodec());
        store.init();
        bus = new EventBus(store, Clock.fixed(Instant.parse("2026-05-04T12:00:00.123456Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static BridgeEvent toTrading(String type) {
        return BridgeEvent.of(type, Map.of("agent_id", "analyst"), EntrySource.AI_FRAMEWORK, EntrySource.TRADING_FRAMEWORK);
    }

    @Test
    void shouldStampAndPersistPublishedEvent() {
        BridgeEvent published = bus.publish(toTrading("agent_decision_made"));

        assertTrue(published.id().startsWith("evt-"));
        assertEquals(Instant.parse("2026-05-04T12:00:00.123Z"), published.createdAt());

        MemoryEntry logged = store.get(EntryCategory.EVENT, published.id()).orElseThrow();
        assertEquals(published, BridgeEvent.fromEntry(logged));
    }

    @Test
    void shouldDeliverToMatchingHandlersInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        bus.subscribe("agent_decision_made", e -> calls.add("type"));
        bus.subscribe(EntrySource.TRADING_FRAMEWORK, e -> calls.add("trading"));
        bus.subscribe(EntrySource.AI_FRAMEWORK, e -> calls.add("ai"));
        bus.subscribeAll(e -> calls.add("all"));
        bus.subscribe("market_bar_received", e -> calls.add("other-type"));

        bus.publish(toTrading("agent_decision_made"));

        assertEquals(List.of("type", "trading", "all"), calls);
    }

    @Test
    void shouldDeliverBroadcastToEveryTarget() {
        List<String> calls = new ArrayList<>();
        bus.subscribe(EntrySource.TRADING_FRAMEWORK, e -> calls.add("trading"));
        bus.subscribe(EntrySource.AI_FRAMEWORK, e -> calls.add("ai"));

        bus.publish(BridgeEvent.of("trading_signal_generated", Map.of(), EntrySource.AI_FRAMEWORK, null));

        assertEquals(List.of("trading", "ai"), calls);
    }

    @Test
    void shouldMatchTypeAndTargetTogether() {
        List<BridgeEvent> received = new ArrayList<>();
        bus.subscribe("high_confidence_signal", EntrySource.TRADING_FRAMEWORK, received::add);

        bus.publish(BridgeEvent.of("high_confidence_signal", Map.of(), EntrySource.AI_FRAMEWORK, EntrySource.AI_FRAMEWORK));
        bus.publish(toTrading("agent_decision_made"));
        bus.publish(toTrading("high_confidence_signal"));

        assertEquals(1, received.size());
        assertEquals(EntrySource.TRADING_FRAMEWORK, received.get(0).target());
    }

    @Test
    void shouldIsolateFailingHandler() {
        List<String> calls = new ArrayList<>();
        bus.subscribeAll(e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribeAll(e -> calls.add("second"));

        assertDoesNotThrow(() -> bus.publish(toTrading("agent_decision_made")));
        assertEquals(List.of("second"), calls);
    }

    @Test
    void shouldNotReplayPastEventsToLateSubscribers() {
        BridgeEvent missed = bus.publish(toTrading("agent_decision_made"));
        List<BridgeEvent> received = new ArrayList<>();

        bus.subscribeAll(received::add);

        assertTrue(received.isEmpty());
        List<BridgeEvent> pending = bus.pending(EntrySource.TRADING_FRAMEWORK, 10);
        assertEquals(1, pending.size());
        assertEquals(missed.id(), pending.get(0).id());
        assertFalse(pending.get(0).processed());
    }

    @Test
    void shouldStopDeliveringAfterUnsubscribe() {
        List<BridgeEvent> received = new ArrayList<>();
        Subscription subscription = bus.subscribeAll(received::add);

        assertTrue(bus.unsubscribe(subscription));
        assertFalse(bus.unsubscribe(subscription));
        bus.publish(toTrading("agent_decision_made"));

        assertTrue(received.isEmpty());
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    void shouldRemoveProcessedEventsFromPending() {
        BridgeEvent event = bus.publish(toTrading("agent_decision_made"));

        assertTrue(bus.markProcessed(event.id()));

        assertTrue(bus.pending(EntrySource.TRADING_FRAMEWORK, 10).isEmpty());
        assertTrue(BridgeEvent.fromEntry(store.get(EntryCategory.EVENT, event.id()).orElseThrow()).processed());
    }

    @Test
    void shouldNotInvokeHandlersWhenEventCannotBeLogged() {
        DurableStore failing = mock(DurableStore.class);
        doThrow(new StoreException("disk full")).when(failing).put(any());
        var failingBus = new EventBus(failing, Clock.systemUTC());
        List<BridgeEvent> received = new ArrayList<>();
        failingBus.subscribeAll(received::add);

        assertThrows(StoreException.class, () -> failingBus.publish(toTrading("agent_decision_made")));
        assertTrue(received.isEmpty());
    }

    @Test
    void shouldRejectInvalidSubscriptions() {
        assertThrows(IllegalArgumentException.class, () -> bus.subscribe("", e -> { }));
        assertThrows(IllegalArgumentException.class, () -> bus.subscribe((EntrySource) null, e -> { }));
        assertThrows(IllegalArgumentException.class, () -> bus.subscribeAll(null));
    }

    @Test
    void eventShouldRequireTypeAndSource() {
        assertThrows(IllegalArgumentException.class, () -> BridgeEvent.of(" ", Map.of(), EntrySource.SHARED, null));
        assertThrows(NullPointerException.class, () -> BridgeEvent.of("x", Map.of(), null, null));
        assertThrows(IllegalStateException.class, () -> toTrading("unpublished").toEntry());
    }

    @Test
    void shouldAllowHandlersToChangeSubscriptionsWhilePublishing() {
        List<BridgeEvent> late = new ArrayList<>();
        List<BridgeEvent> once = new ArrayList<>();
        Subscription[] self = new Subscription[1];
        self[0] = bus.subscribeAll(event -> {
            once.add(event);
            bus.unsubscribe(self[0]);
            bus.subscribeAll(late::add);
        });

        assertDoesNotThrow(() -> bus.publish(toTrading("agent_decision_made")));
        bus.publish(toTrading("high_confidence_signal"));

        assertEquals(1, once.size());
        assertEquals(List.of("high_confidence_signal"), late.stream().map(BridgeEvent::eventType).toList());
        assertEquals(1, bus.subscriberCount());
    }

    @Test
    void shouldDeliverEveryEventWhilePublishersAndSubscribersRace() throws Exception {
        AtomicInteger delivered = new AtomicInteger();
        bus.subscribe(EntrySource.TRADING_FRAMEWORK, event -> delivered.incrementAndGet());
        int publishers = 4;
        int perPublisher = 25;
        ExecutorService pool = Executors.newFixedThreadPool(publishers + 1);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int p = 0; p < publishers; p++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perPublisher; i++) {
                        bus.publish(toTrading("agent_decision_made"));
                    }
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    bus.unsubscribe(bus.subscribeAll(event -> { }));
                }
                return null;
            }));
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(publishers * perPublisher, delivered.get());
        assertEquals(publishers * perPublisher, bus.pending(EntrySource.TRADING_FRAMEWORK, 1000).size());
        assertEquals(1, bus.subscriberCount());
    }
}
