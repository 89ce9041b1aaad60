package io.agentbridge.cache;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Primary backend stand-in that can be switched off, or made to fail a number of calls.
 */
public class FakeCacheBackend implements CacheBackend {

    public final Map<String, String> values = new ConcurrentHashMap<>();
    public final AtomicInteger calls = new AtomicInteger();
    public volatile boolean down;
    public final AtomicInteger failuresLeft = new AtomicInteger();

    @Override
    public void set(String key, String value, Duration ttl, boolean durableCopy) {
        check("SET");
        values.put(key, value);
    }

    @Override
    public Optional<String> get(String key) {
        check("GET");
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void delete(String key) {
        check("DEL");
        values.remove(key);
    }

    @Override
    public boolean ping() {
        calls.incrementAndGet();
        return !down;
    }

    @Override
    public String name() {
        return "fake";
    }

    @Override
    public void close() {
        values.clear();
    }

    private void check(String op) {
        calls.incrementAndGet();
        if (down) {
            throw new CacheUnavailableException(op + " refused: backend down");
        }
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new CacheUnavailableException(op + " timed out");
        }
    }
}
