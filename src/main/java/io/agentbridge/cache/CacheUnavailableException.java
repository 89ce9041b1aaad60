package io.agentbridge.cache;

/**
 * The cache backend could not be reached or did not answer in time.
 * Always recoverable: {@link FailoverVolatileCache} absorbs it and falls back to the in-process cache.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public CacheUnavailableException(String message) {
        super(message);
    }
}
