package io.agentbridge.bridge;

import io.agentbridge.memory.EntryCategory;
import io.agentbridge.memory.EntrySource;
import io.agentbridge.memory.MemoryEntry;
import io.agentbridge.memory.MemoryType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Agent decisions, stored either as {@code AGENT_DECISION} or, when acted upon, as
 * {@code TRADING_SIGNAL}. Keyed {@code {agent}:{decision_type}:{epoch_millis}}.
 */
public class DecisionAdapter implements BridgeAdapter<AgentDecision> {

    @Override
    public MemoryEntry toEntry(AgentDecision decision, EntryCategory category) {
        if (!supports(category)) {
            throw new IllegalArgumentException("Decisions cannot be stored as " + category);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent_id", decision.agentId());
        payload.put("decision_type", decision.decisionType());
        payload.put("decision_data", decision.data());
        payload.put("confidence", decision.confidence());
        payload.put("task_id", decision.taskId());
        payload.put("timestamp", decision.timestamp().toString());

        return new MemoryEntry(category, keyFor(decision), payload, EntrySource.AI_FRAMEWORK, MemoryType.BOTH,
                null, null, decision.confidence());
    }

    @Override
    public AgentDecision fromEntry(MemoryEntry entry) {
        return new AgentDecision(
                PayloadFields.requireString(entry, "agent_id"),
                PayloadFields.requireString(entry, "decision_type"),
                PayloadFields.map(entry, "decision_data"),
                PayloadFields.number(entry, "confidence").doubleValue(),
                PayloadFields.string(entry, "task_id"),
                Instant.parse(PayloadFields.requireString(entry, "timestamp"))
        );
    }

    @Override
    public boolean supports(EntryCategory category) {
        return category == EntryCategory.AGENT_DECISION || category == EntryCategory.TRADING_SIGNAL;
    }

    public static String keyFor(AgentDecision decision) {
        return EntryKeys.of(decision.agentId(), decision.decisionType(), decision.timestamp().toEpochMilli());
    }
}
