package io.agentbridge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentbridge.bridge.DataBridge;
import io.agentbridge.cache.CacheBackend;
import io.agentbridge.cache.FailoverVolatileCache;
import io.agentbridge.cache.InMemoryCache;
import io.agentbridge.cache.RedisCacheBackend;
import io.agentbridge.core.UnifiedMemory;
import io.agentbridge.event.EventBus;
import io.agentbridge.memory.EntryCodec;
import io.agentbridge.memory.SQLiteDurableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the shared memory system. The store and cache are owned and closed by
 * {@link UnifiedMemory}; the container closes only the facade.
 */
@Configuration
@EnableConfigurationProperties(MemoryProperties.class)
public class MemoryConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EntryCodec entryCodec(ObjectMapper objectMapper) {
        return new EntryCodec(objectMapper);
    }

    @Bean(destroyMethod = "")
    public SQLiteDurableStore durableStore(MemoryProperties properties, EntryCodec codec, Clock clock) {
        var store = new SQLiteDurableStore(properties.store().path(), codec, clock);
        store.init();
        return store;
    }

    @Bean(destroyMethod = "")
    public FailoverVolatileCache volatileCache(MemoryProperties properties, Clock clock) {
        MemoryProperties.Cache cacheProps = properties.cache();
        MemoryProperties.Redis redis = properties.redis();

        CacheBackend primary = null;
        if (redis.enabled()) {
            primary = new RedisCacheBackend(redis.host(), redis.port(), redis.password(), redis.database(),
                    redis.timeout());
        } else {
            log.info("Redis disabled via configuration");
        }

        var cache = new FailoverVolatileCache(primary, new InMemoryCache(cacheProps.maxLocalEntries(), clock),
                cacheProps.namespace(), cacheProps.recheckInterval(), cacheProps.maxAttempts());
        cache.checkPrimary();
        return cache;
    }

    @Bean
    public EventBus eventBus(SQLiteDurableStore durableStore, Clock clock) {
        return new EventBus(durableStore, clock);
    }

    @Bean(destroyMethod = "close")
    public UnifiedMemory unifiedMemory(SQLiteDurableStore durableStore, FailoverVolatileCache volatileCache,
                                       EventBus eventBus, EntryCodec codec, MemoryProperties properties,
                                       Clock clock) {
        return new UnifiedMemory(durableStore, volatileCache, eventBus, codec, properties.ttl().asMap(), clock);
    }

    @Bean
    public DataBridge dataBridge(UnifiedMemory unifiedMemory, MemoryProperties properties) {
        return new DataBridge(unifiedMemory, properties.bridge().highConfidenceThreshold());
    }
}
