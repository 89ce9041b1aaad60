package io.agentbridge.config;

import io.agentbridge.memory.EntryCategory;
import io.agentbridge.memory.RetentionPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration of the shared memory system.
 *
 * <p>Binds to {@code agentbridge.memory} in application.yml:</p>
 * <pre>
 * agentbridge:
 *   memory:
 *     store:
 *       path: ./data/agent-bridge.db
 *     cache:
 *       namespace: agentbridge
 *       max-local-entries: 10000
 *       recheck-interval: 30s
 *     redis:
 *       enabled: ${AGENTBRIDGE_REDIS_ENABLED:true}
 *       host: localhost
 *       port: 6379
 *       timeout: 100ms
 *     ttl:
 *       market-data: 1h
 *       agent-decision: 30m
 *     retention:
 *       interval-minutes: 60
 *       max-age: 7d
 *       pending-event-max-age: 30d
 *     bridge:
 *       high-confidence-threshold: 0.8
 * </pre>
 */
@ConfigurationProperties(prefix = "agentbridge.memory")
public record MemoryProperties(
        Store store,
        Cache cache,
        Redis redis,
        Ttl ttl,
        Retention retention,
        Bridge bridge
) {
    public MemoryProperties {
        if (store == null) store = new Store(null);
        if (cache == null) cache = new Cache(null, 0, null, 0);
        if (redis == null) redis = new Redis(false, null, 0, null, 0, null);
        if (ttl == null) ttl = new Ttl(null, null, null, null, null);
        if (retention == null) retention = new Retention(null, 0, null, 0, null, null);
        if (bridge == null) bridge = new Bridge(null);
    }

    /**
     * @param path SQLite database file
     */
    public record Store(String path) {
        public Store {
            if (path == null || path.isBlank()) {
                path = "./data/agent-bridge.db";
            }
        }
    }

    /**
     * @param namespace       prefix of every cache key
     * @param maxLocalEntries capacity of the in-process fallback
     * @param recheckInterval   how long a failed backend is bypassed before it is tried again
     * @param maxAttempts     attempts per backend call, including the first
     */
    public record Cache(String namespace, int maxLocalEntries, Duration recheckInterval, int maxAttempts) {
        public Cache {
            if (namespace == null || namespace.isBlank()) {
                namespace = "agentbridge";
            }
            if (maxLocalEntries <= 0) {
                maxLocalEntries = 10_000;
            }
            if (recheckInterval == null) {
                recheckInterval = Duration.ofSeconds(30);
            }
            if (maxAttempts <= 0) {
                maxAttempts = 2;
            }
        }
    }

    /**
     * @param enabled  false runs the cache in-process only
     * @param timeout  connect and command timeout
     */
    public record Redis(boolean enabled, String host, int port, String password, int database, Duration timeout) {
        public Redis {
            if (host == null || host.isBlank()) {
                host = "localhost";
            }
            if (port <= 0) {
                port = 6379;
            }
            if (timeout == null) {
                timeout = Duration.ofMillis(100);
            }
        }
    }

    /**
     * Cache TTL applied when an entry carries none.
     */
    public record Ttl(Duration marketData, Duration agentDecision, Duration tradingSignal,
                      Duration systemState, Duration event) {
        public Ttl {
            if (marketData == null) marketData = Duration.ofHours(1);
            if (agentDecision == null) agentDecision = Duration.ofMinutes(30);
            if (tradingSignal == null) tradingSignal = Duration.ofMinutes(15);
            if (systemState == null) systemState = Duration.ofMinutes(5);
            if (event == null) event = Duration.ofMinutes(5);
        }

        public Map<EntryCategory, Duration> asMap() {
            Map<EntryCategory, Duration> ttls = new EnumMap<>(EntryCategory.class);
            ttls.put(EntryCategory.MARKET_DATA, marketData);
            ttls.put(EntryCategory.AGENT_DECISION, agentDecision);
            ttls.put(EntryCategory.TRADING_SIGNAL, tradingSignal);
            ttls.put(EntryCategory.SYSTEM_STATE, systemState);
            ttls.put(EntryCategory.EVENT, event);
            return ttls;
        }
    }

    /**
     * @param enabled               whether the recurring sweep jobs are registered
     * @param intervalMinutes       how often the durable store is swept
     * @param maxAge                durable entries older than this are removed
     * @param maxEntriesPerCategory count bound per category, 0 for none
     * @param cachePurgeInterval    how often expired in-process cache entries are purged
     * @param pendingEventMaxAge    unprocessed events older than this are removed
     */
    public record Retention(Boolean enabled, int intervalMinutes, Duration maxAge,
                            int maxEntriesPerCategory, Duration cachePurgeInterval,
                            Duration pendingEventMaxAge) {
        public Retention {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (intervalMinutes <= 0) {
                intervalMinutes = 60;
            }
            if (maxAge == null) {
                maxAge = Duration.ofDays(7);
            }
            if (maxEntriesPerCategory < 0) {
                maxEntriesPerCategory = 0;
            }
            if (cachePurgeInterval == null) {
                cachePurgeInterval = Duration.ofMinutes(1);
            }
            if (pendingEventMaxAge == null) {
                pendingEventMaxAge = Duration.ofDays(30);
            }
        }

        public RetentionPolicy toPolicy() {
            return RetentionPolicy.keepFor(maxAge, maxEntriesPerCategory, pendingEventMaxAge);
        }
    }

    /**
     * @param highConfidenceThreshold decisions above this confidence raise a high-confidence signal
     */
    public record Bridge(Double highConfidenceThreshold) {
        public Bridge {
            if (highConfidenceThreshold == null) {
                highConfidenceThreshold = 0.8;
            }
            if (highConfidenceThreshold < 0.0 || highConfidenceThreshold > 1.0) {
                throw new IllegalArgumentException(
                        "high-confidence-threshold must be within [0,1]: " + highConfidenceThreshold);
            }
        }
    }
}
