package io.agentbridge.cache;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SetArgs;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Redis cache backend (standalone node) built on Lettuce.
 *
 * <p>The connection is opened lazily and re-opened after it is lost. Connect and
 * command timeouts are both bounded by {@code timeout}; commands issued while the
 * connection is down are rejected immediately instead of being queued.</p>
 */
public class RedisCacheBackend implements CacheBackend {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheBackend.class);

    private final String host;
    private final int port;
    private final String password;
    private final int database;
    private final Duration timeout;

    private final AtomicReference<RedisClient> redisClient = new AtomicReference<>();
    private final AtomicReference<StatefulRedisConnection<String, String>> connection = new AtomicReference<>();

    public RedisCacheBackend(String host, int port, String password, int database, Duration timeout) {
        this.host = host;
        this.port = port;
        this.password = password;
        this.database = database;
        this.timeout = timeout;
    }

    @Override
    public void set(String key, String value, Duration ttl, boolean durableCopy) {
        try {
            RedisCommands<String, String> commands = commands();
            if (ttl == null) {
                commands.set(key, value);
            } else {
                commands.set(key, value, SetArgs.Builder.px(ttl.toMillis()));
            }
        } catch (RedisException e) {
            throw unavailable("SET", e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(commands().get(key));
        } catch (RedisException e) {
            throw unavailable("GET", e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            commands().del(key);
        } catch (RedisException e) {
            throw unavailable("DEL", e);
        }
    }

    @Override
    public boolean ping() {
        try {
            return "PONG".equals(commands().ping());
        } catch (RedisException | CacheUnavailableException e) {
            log.debug("PING failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String name() {
        return "redis://" + host + ":" + port + "/" + database;
    }

    @Override
    public void close() {
        StatefulRedisConnection<String, String> conn = connection.getAndSet(null);
        if (conn != null) {
            try {
                conn.close();
            } catch (RedisException e) {
                log.debug("Error closing Redis connection: {}", e.getMessage());
            }
        }

        RedisClient client = redisClient.getAndSet(null);
        if (client != null) {
            client.shutdown();
        }
        log.info("Disconnected from Redis at {}:{}", host, port);
    }

    private RedisCommands<String, String> commands() {
        StatefulRedisConnection<String, String> conn = connection.get();
        if (conn != null && conn.isOpen()) {
            return conn.sync();
        }
        return connect().sync();
    }

    private synchronized StatefulRedisConnection<String, String> connect() {
        StatefulRedisConnection<String, String> current = connection.get();
        if (current != null && current.isOpen()) {
            return current;
        }
        if (current != null) {
            current.closeAsync();
        }

        log.info("Connecting to Redis at {}:{}", host, port);
        RedisClient client = redisClient.updateAndGet(c -> c != null ? c : createClient());
        try {
            StatefulRedisConnection<String, String> conn = client.connect();
            conn.setTimeout(timeout);
            connection.set(conn);
            log.info("Connected to Redis at {}:{}", host, port);
            return conn;
        } catch (RedisException e) {
            connection.set(null);
            throw unavailable("CONNECT", e);
        }
    }

    private RedisClient createClient() {
        RedisURI.Builder uriBuilder = RedisURI.builder()
                .withHost(host)
                .withPort(port)
                .withDatabase(database)
                .withTimeout(timeout);

        if (password != null && !password.isEmpty()) {
            uriBuilder.withPassword(password.toCharArray());
        }

        RedisClient client = RedisClient.create(uriBuilder.build());
        client.setOptions(ClientOptions.builder()
                .autoReconnect(true)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .socketOptions(SocketOptions.builder().connectTimeout(timeout).build())
                .timeoutOptions(TimeoutOptions.enabled(timeout))
                .build());
        return client;
    }

    private CacheUnavailableException unavailable(String operation, RedisException e) {
        return new CacheUnavailableException(
                "Redis %s failed at %s:%d: %s".formatted(operation, host, port, e.getMessage()), e);
    }
}
