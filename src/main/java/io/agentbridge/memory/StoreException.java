package io.agentbridge.memory;

/**
 * A durable store operation failed. Durable failures are always surfaced to the
 * caller; the store itself stays usable.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
