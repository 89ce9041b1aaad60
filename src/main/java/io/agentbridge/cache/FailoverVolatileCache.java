package io.agentbridge.cache;

import io.agentbridge.memory.EntryCategory;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * {@link VolatileCache} over an optional primary backend (Redis) with an in-process fallback.
 *
 * <p>Calls to the primary go through a {@link Retry} (one retry) inside a
 * {@link CircuitBreaker} that opens on the first failed call. While the breaker is open the
 * primary is not contacted; after {@code recheckInterval} the next call tries it again and a
 * success closes the breaker. Every operation that cannot reach the primary is served by the
 * in-process {@link InMemoryCache}.</p>
 *
 * <p>A key whose primary copy may be out of date (a delete that did not reach the primary, or a
 * write served by the fallback) is remembered as stale. Reads of a stale key never go to the
 * primary, and the pending deletes are replayed once the primary answers again.</p>
 *
 * <p>Without a primary backend the in-process cache is used directly and the cache is never
 * reported as degraded.</p>
 */
public class FailoverVolatileCache implements VolatileCache {

    private static final Logger log = LoggerFactory.getLogger(FailoverVolatileCache.class);

    private static final Duration RETRY_WAIT = Duration.ofMillis(10);
    private static final int LOCK_STRIPES = 64;

    private final CacheBackend primary;
    private final InMemoryCache local;
    private final String namespace;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;

    private final AtomicBoolean degradedNotice = new AtomicBoolean(false);
    private final AtomicLong fallbacks = new AtomicLong();
    private final Set<String> staleKeys = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean replaying = new AtomicBoolean(false);
    private final ReentrantLock[] keyLocks = new ReentrantLock[LOCK_STRIPES];

    /**
     * @param primary       external backend, or null for in-process only
     * @param local         in-process fallback
     * @param namespace     prefix of every key
     * @param recheckInterval how long the primary is left alone after a failure
     * @param maxAttempts   attempts per primary call, including the first
     */
    public FailoverVolatileCache(CacheBackend primary, InMemoryCache local, String namespace,
                                 Duration recheckInterval, int maxAttempts) {
        this.primary = primary;
        this.local = local;
        this.namespace = namespace;

        String name = primary != null ? primary.name() : local.name();
        this.circuitBreaker = CircuitBreaker.of(name, CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(1)
                .minimumNumberOfCalls(1)
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(recheckInterval)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordExceptions(CacheUnavailableException.class)
                .build());
        this.retry = Retry.of(name, RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .waitDuration(RETRY_WAIT)
                .retryExceptions(CacheUnavailableException.class)
                .build());

        for (int i = 0; i < LOCK_STRIPES; i++) {
            keyLocks[i] = new ReentrantLock();
        }
        registerEventListeners();
    }

    public FailoverVolatileCache(CacheBackend primary, InMemoryCache local, String namespace,
                                 Duration recheckInterval) {
        this(primary, local, namespace, recheckInterval, 2);
    }

    /**
     * Checks the primary once at startup so an unreachable backend is detected before the first write.
     *
     * @return true if the primary answered, or if there is no primary
     */
    public boolean checkPrimary() {
        if (primary == null) {
            log.info("Volatile cache running in-process only");
            return true;
        }
        try {
            callPrimary(() -> {
                if (!primary.ping()) {
                    throw new CacheUnavailableException("No PONG from " + primary.name());
                }
                return Boolean.TRUE;
            });
            log.info("Volatile cache connected to {}", primary.name());
            replayStaleDeletes();
            return true;
        } catch (CacheUnavailableException | CallNotPermittedException e) {
            log.warn("Volatile cache backend {} unreachable, using in-process fallback: {}",
                    primary.name(), e.getMessage());
            return false;
        }
    }

    @Override
    public CacheWrite set(EntryCategory category, String key, String value, Duration ttl, boolean durableCopy) {
        String cacheKey = cacheKey(category, key);
        if (primary == null) {
            local.set(cacheKey, value, ttl, durableCopy);
            return CacheWrite.PRIMARY;
        }
        CacheWrite landed;
        ReentrantLock lock = lockFor(cacheKey);
        lock.lock();
        try {
            callPrimary(() -> {
                primary.set(cacheKey, value, ttl, durableCopy);
                return Boolean.TRUE;
            });
            staleKeys.remove(cacheKey);
            local.delete(cacheKey);
            landed = CacheWrite.PRIMARY;
        } catch (CacheUnavailableException | CallNotPermittedException e) {
            fallbacks.incrementAndGet();
            log.debug("SET {} served by in-process fallback: {}", cacheKey, e.getMessage());
            local.set(cacheKey, value, ttl, durableCopy);
            staleKeys.add(cacheKey);
            landed = CacheWrite.FALLBACK;
        } finally {
            lock.unlock();
        }
        if (landed == CacheWrite.PRIMARY) {
            replayStaleDeletes();
        }
        return landed;
    }

    @Override
    public Optional<String> get(EntryCategory category, String key) {
        String cacheKey = cacheKey(category, key);
        Optional<String> localValue = local.get(cacheKey);
        if (localValue.isPresent() || primary == null) {
            return localValue;
        }
        if (staleKeys.contains(cacheKey)) {
            return Optional.empty();
        }
        try {
            Optional<String> value = callPrimary(() -> primary.get(cacheKey));
            replayStaleDeletes();
            return value;
        } catch (CacheUnavailableException | CallNotPermittedException e) {
            fallbacks.incrementAndGet();
            log.debug("GET {} missed, primary unavailable: {}", cacheKey, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void delete(EntryCategory category, String key) {
        String cacheKey = cacheKey(category, key);
        local.delete(cacheKey);
        if (primary == null) {
            return;
        }
        boolean reached;
        ReentrantLock lock = lockFor(cacheKey);
        lock.lock();
        try {
            deleteFromPrimary(cacheKey);
            staleKeys.remove(cacheKey);
            reached = true;
        } catch (CacheUnavailableException | CallNotPermittedException e) {
            fallbacks.incrementAndGet();
            staleKeys.add(cacheKey);
            log.debug("DEL {} could not reach {}, kept for replay: {}", cacheKey, primary.name(), e.getMessage());
            reached = false;
        } finally {
            lock.unlock();
        }
        if (reached) {
            replayStaleDeletes();
        }
    }

    /**
     * Deletes stale keys from the primary, stopping at the first failure. Keys rewritten on the
     * primary in the meantime are skipped.
     *
     * @return number of keys deleted from the primary
     */
    int replayStaleDeletes() {
        if (primary == null || staleKeys.isEmpty() || !replaying.compareAndSet(false, true)) {
            return 0;
        }
        int replayed = 0;
        try {
            for (String cacheKey : staleKeys) {
                ReentrantLock lock = lockFor(cacheKey);
                lock.lock();
                try {
                    if (!staleKeys.contains(cacheKey)) {
                        continue;
                    }
                    deleteFromPrimary(cacheKey);
                    staleKeys.remove(cacheKey);
                    replayed++;
                } catch (CacheUnavailableException | CallNotPermittedException e) {
                    log.debug("Replay of stale deletes on {} interrupted: {}", primary.name(), e.getMessage());
                    break;
                } finally {
                    lock.unlock();
                }
            }
        } finally {
            replaying.set(false);
        }
        if (replayed > 0) {
            log.info("Removed {} stale keys from {}", replayed, primary.name());
        }
        return replayed;
    }

    int staleKeyCount() {
        return staleKeys.size();
    }

    private void deleteFromPrimary(String cacheKey) {
        callPrimary(() -> {
            primary.delete(cacheKey);
            return Boolean.TRUE;
        });
    }

    @Override
    public boolean isDegraded() {
        return primary != null && circuitBreaker.getState() != CircuitBreaker.State.CLOSED;
    }

    @Override
    public boolean consumeDegradedNotice() {
        return degradedNotice.compareAndSet(true, false);
    }

    @Override
    public int purgeExpired() {
        return local.purgeExpired();
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(
                primary != null ? primary.name() : local.name(),
                primary != null ? circuitBreaker.getState().name() : "LOCAL",
                isDegraded(),
                local.size(),
                local.evictions(),
                local.drops(),
                local.expirations(),
                fallbacks.get()
        );
    }

    @Override
    public void close() {
        if (primary != null) {
            primary.close();
        }
        local.close();
    }

    String cacheKey(EntryCategory category, String key) {
        return namespace + ":" + category.cacheSegment() + ":" + key;
    }

    private ReentrantLock lockFor(String cacheKey) {
        return keyLocks[Math.floorMod(cacheKey.hashCode(), LOCK_STRIPES)];
    }

    private <T> T callPrimary(Supplier<T> call) {
        return circuitBreaker.executeSupplier(Retry.decorateSupplier(retry, call));
    }

    private void registerEventListeners() {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> {
                    CircuitBreaker.State from = event.getStateTransition().getFromState();
                    CircuitBreaker.State to = event.getStateTransition().getToState();
                    log.info("Cache backend {} state change: {} -> {}", circuitBreaker.getName(), from, to);

                    if (from == CircuitBreaker.State.CLOSED && to == CircuitBreaker.State.OPEN) {
                        degradedNotice.set(true);
                        log.warn("Cache backend {} down, serving from in-process fallback", circuitBreaker.getName());
                    } else if (to == CircuitBreaker.State.CLOSED) {
                        degradedNotice.set(false);
                        log.info("Cache backend {} recovered", circuitBreaker.getName());
                    }
                })
                .onError(event -> log.debug("Cache backend {} recorded error: {}",
                        circuitBreaker.getName(), event.getThrowable().getMessage()));
    }
}
