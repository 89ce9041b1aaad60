package io.agentbridge.bridge;

import io.agentbridge.core.UnifiedMemory;
import io.agentbridge.core.WriteResult;
import io.agentbridge.event.BridgeEvent;
import io.agentbridge.memory.EntryCategory;
import io.agentbridge.memory.EntryFilter;
import io.agentbridge.memory.EntrySource;
import io.agentbridge.memory.MemoryEntry;
import io.agentbridge.memory.MemoryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Consumer-facing bridge between the trading and AI subsystems.
 *
 * <p>Translates native objects through the adapters, writes them to the shared
 * {@link UnifiedMemory}, and notifies the other side with an event once the write is
 * committed. A failed write publishes nothing.</p>
 */
public class DataBridge {

    private static final Logger log = LoggerFactory.getLogger(DataBridge.class);

    public static final String MARKET_BAR_RECEIVED = "market_bar_received";
    public static final String MARKET_TICK_RECEIVED = "market_tick_received";
    public static final String ORDERBOOK_UPDATED = "orderbook_updated";
    public static final String AGENT_DECISION_MADE = "agent_decision_made";
    public static final String HIGH_CONFIDENCE_SIGNAL = "high_confidence_signal";
    public static final String TRADING_SIGNAL_GENERATED = "trading_signal_generated";
    public static final String SYSTEM_STATE_UPDATED = "system_state_updated";

    private final UnifiedMemory memory;
    private final double highConfidenceThreshold;
    private final MarketBarAdapter barAdapter = new MarketBarAdapter();
    private final MarketTickAdapter tickAdapter = new MarketTickAdapter();
    private final OrderBookAdapter orderBookAdapter = new OrderBookAdapter();
    private final DecisionAdapter decisionAdapter = new DecisionAdapter();

    /**
     * @param highConfidenceThreshold decisions with a confidence above this value also
     *                                raise {@value #HIGH_CONFIDENCE_SIGNAL}
     */
    public DataBridge(UnifiedMemory memory, double highConfidenceThreshold) {
        this.memory = memory;
        this.highConfidenceThreshold = highConfidenceThreshold;
    }

    // --- Trading side -> AI side ---

    public WriteResult onBar(MarketBar bar) {
        MemoryEntry entry = barAdapter.toEntry(bar, EntryCategory.MARKET_DATA);
        WriteResult result = memory.write(entry);
        if (result.isCommitted()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("instrument_id", bar.instrumentId());
            data.put("key", entry.key());
            data.put("bar_data", entry.payload());
            data.put("timestamp", bar.tsEvent());
            memory.publish(BridgeEvent.of(MARKET_BAR_RECEIVED, data,
                    EntrySource.TRADING_FRAMEWORK, EntrySource.AI_FRAMEWORK));
            log.debug("Bar stored for {}: {}", bar.instrumentId(), entry.key());
        } else {
            log.warn("Bar not stored for {}: {}", bar.instrumentId(), result.detail());
        }
        return result;
    }

    public WriteResult onTick(MarketTick tick) {
        MemoryEntry entry = tickAdapter.toEntry(tick, EntryCategory.MARKET_DATA);
        WriteResult result = memory.write(entry);
        if (result.isCommitted()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("instrument_id", tick.instrumentId());
            data.put("key", entry.key());
            data.put("tick_data", entry.payload());
            data.put("timestamp", tick.tsEvent());
            memory.publish(BridgeEvent.of(MARKET_TICK_RECEIVED, data,
                    EntrySource.TRADING_FRAMEWORK, EntrySource.AI_FRAMEWORK));
        }
        return result;
    }

    public WriteResult onOrderBook(OrderBookSnapshot book) {
        MemoryEntry entry = orderBookAdapter.toEntry(book, EntryCategory.MARKET_DATA);
        WriteResult result = memory.write(entry);
        if (result.isCommitted()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("instrument_id", book.instrumentId());
            data.put("key", entry.key());
            data.put("orderbook_data", entry.payload());
            data.put("timestamp", book.tsEvent());
            memory.publish(BridgeEvent.of(ORDERBOOK_UPDATED, data,
                    EntrySource.TRADING_FRAMEWORK, EntrySource.AI_FRAMEWORK));
        }
        return result;
    }

    public Optional<MarketBar> latestBar(String instrumentId) {
        return memory.readLatest(EntryCategory.MARKET_DATA, EntryKeys.prefix(instrumentId, MarketBarAdapter.TYPE))
                .map(barAdapter::fromEntry);
    }

    public Optional<MarketBar> bar(String instrumentId, long tsEvent) {
        return memory.read(EntryCategory.MARKET_DATA, EntryKeys.of(instrumentId, MarketBarAdapter.TYPE, tsEvent))
                .map(barAdapter::fromEntry);
    }

    public Optional<MarketTick> tick(String instrumentId, long tsEvent) {
        return memory.read(EntryCategory.MARKET_DATA, EntryKeys.of(instrumentId, MarketTickAdapter.TYPE, tsEvent))
                .map(tickAdapter::fromEntry);
    }

    public Optional<OrderBookSnapshot> orderBook(String instrumentId, long tsEvent) {
        return memory.read(EntryCategory.MARKET_DATA, EntryKeys.of(instrumentId, OrderBookAdapter.TYPE, tsEvent))
                .map(orderBookAdapter::fromEntry);
    }

    // --- AI side -> trading side ---

    /**
     * Saves a decision and notifies the trading side. A decision whose confidence is above the
     * threshold additionally raises {@value #HIGH_CONFIDENCE_SIGNAL}.
     */
    public WriteResult saveDecision(AgentDecision decision) {
        MemoryEntry entry = decisionAdapter.toEntry(decision, EntryCategory.AGENT_DECISION);
        WriteResult result = memory.write(entry);
        if (!result.isCommitted()) {
            log.warn("Decision not stored for agent {}: {}", decision.agentId(), result.detail());
            return result;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agent_id", decision.agentId());
        data.put("decision_type", decision.decisionType());
        data.put("decision_data", decision.data());
        data.put("confidence", decision.confidence());
        data.put("task_id", decision.taskId());
        data.put("key", entry.key());
        memory.publish(BridgeEvent.of(AGENT_DECISION_MADE, data,
                EntrySource.AI_FRAMEWORK, EntrySource.TRADING_FRAMEWORK));
        log.info("Agent decision saved: {} - {}", decision.agentId(), decision.decisionType());

        if (decision.confidence() > highConfidenceThreshold) {
            Map<String, Object> signal = new LinkedHashMap<>();
            signal.put("agent_id", decision.agentId());
            signal.put("decision_type", decision.decisionType());
            signal.put("confidence", decision.confidence());
            signal.put("key", entry.key());
            memory.publish(BridgeEvent.of(HIGH_CONFIDENCE_SIGNAL, signal,
                    EntrySource.AI_FRAMEWORK, EntrySource.TRADING_FRAMEWORK));
            log.info("High confidence decision: {} - {} ({})",
                    decision.agentId(), decision.decisionType(), decision.confidence());
        }
        return result;
    }

    public Optional<AgentDecision> decision(String agentId, String decisionType, Instant timestamp) {
        String key = EntryKeys.of(agentId, decisionType, timestamp.toEpochMilli());
        return memory.read(EntryCategory.AGENT_DECISION, key).map(decisionAdapter::fromEntry);
    }

    /**
     * Most recent durable decisions of an agent, newest first.
     */
    public List<AgentDecision> recentDecisions(String agentId, int limit) {
        EntryFilter filter = EntryFilter.all().withKeyPrefix(agentId + ":").withLimit(limit);
        return memory.list(EntryCategory.AGENT_DECISION, filter).stream()
                .map(decisionAdapter::fromEntry)
                .toList();
    }

    /**
     * Saves a trading signal and broadcasts {@value #TRADING_SIGNAL_GENERATED} to both sides.
     */
    public WriteResult saveSignal(String signalId, Map<String, Object> signalData, EntrySource source) {
        MemoryEntry entry = MemoryEntry.of(EntryCategory.TRADING_SIGNAL, signalId, signalData, source, MemoryType.BOTH);
        WriteResult result = memory.write(entry);
        if (result.isCommitted()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("signal_id", signalId);
            data.put("signal_data", entry.payload());
            data.put("source", source.name());
            memory.publish(BridgeEvent.of(TRADING_SIGNAL_GENERATED, data, source, null));
            log.info("Trading signal saved: {}", signalId);
        }
        return result;
    }

    public Optional<Map<String, Object>> signal(String signalId) {
        return memory.read(EntryCategory.TRADING_SIGNAL, signalId).map(MemoryEntry::payload);
    }

    /**
     * Signals still within their time-to-live, newest first, among the {@code limit} most recent.
     */
    public List<TradingSignal> activeSignals(int limit) {
        return memory.listActive(EntryCategory.TRADING_SIGNAL, limit).stream()
                .map(TradingSignal::fromEntry)
                .toList();
    }

    // --- Shared ---

    /**
     * Caches a component's state and broadcasts {@value #SYSTEM_STATE_UPDATED}.
     */
    public WriteResult setSystemState(String component, Map<String, Object> state) {
        WriteResult result = memory.write(MemoryEntry.of(EntryCategory.SYSTEM_STATE, component, state,
                EntrySource.SHARED, MemoryType.CACHE_ONLY));
        if (result.isCommitted()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("component", component);
            data.put("source", EntrySource.SHARED.name());
            memory.publish(BridgeEvent.of(SYSTEM_STATE_UPDATED, data, EntrySource.SHARED, null));
        }
        return result;
    }

    public Optional<Map<String, Object>> systemState(String component) {
        return memory.read(EntryCategory.SYSTEM_STATE, component).map(MemoryEntry::payload);
    }

    /**
     * Unprocessed events for one side, oldest first. Used to catch up on notifications
     * missed while no handler was subscribed.
     */
    public List<BridgeEvent> pendingEvents(EntrySource target, int limit) {
        return memory.pendingEvents(target, limit);
    }
}
