package io.agentbridge.bridge;

import io.agentbridge.memory.PayloadValues;

import java.time.Instant;
import java.util.Map;

/**
 * A decision produced by an AI agent, e.g. a buy signal with its rationale.
 *
 * @param agentId      producing agent
 * @param decisionType e.g. {@code buy_signal}, {@code risk_assessment}
 * @param data         decision details, in the canonical payload form
 * @param confidence   score in [0,1]
 * @param taskId       task that produced the decision, may be null
 * @param timestamp    decision time
 */
public record AgentDecision(
        String agentId,
        String decisionType,
        Map<String, Object> data,
        double confidence,
        String taskId,
        Instant timestamp
) {
    public AgentDecision {
        data = PayloadValues.canonicalMap(data);
    }
}
