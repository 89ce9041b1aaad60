package io.agentbridge.memory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent, queryable storage of entries grouped by category.
 * Survives process restarts; durable copies never expire on their own.
 */
public interface DurableStore extends AutoCloseable {

    /** Event type recorded for event-category entries written without one. */
    String DEFAULT_EVENT_TYPE = "entry";

    /**
     * Stores an entry, overwriting any previous entry with the same category and key.
     *
     * @param entry the entry to persist; {@code createdAt} must be set
     * @throws StoreException if the write could not be committed
     */
    void put(MemoryEntry entry);

    /**
     * Gets an entry by category and key.
     *
     * @return the entry, or empty if no such key exists
     * @throws StoreException if the store could not be read
     */
    Optional<MemoryEntry> get(EntryCategory category, String key);

    /**
     * Lists entries of a category, newest first.
     *
     * @param category the category to list
     * @param filter   optional constraints
     * @return matching entries, at most {@code filter.limit()}
     */
    List<MemoryEntry> list(EntryCategory category, EntryFilter filter);

    /**
     * Removes entries older than the policy's horizon, and entries beyond its count bound.
     * Unprocessed events are exempt from the horizon but not from the count bound; they expire
     * after {@link RetentionPolicy#pendingEventMaxAge()}.
     *
     * @return number of removed entries
     */
    int sweep(RetentionPolicy policy);

    /**
     * Returns unprocessed events addressed to the target (or to nobody in particular), oldest first.
     *
     * @param target the consuming side, or null for every unprocessed event
     * @param limit  maximum number of results
     */
    List<MemoryEntry> pendingEvents(EntrySource target, int limit);

    /**
     * Marks an event as handled.
     *
     * @return true if the event exists
     */
    boolean markEventProcessed(String eventId);

    /**
     * Number of durable entries per category.
     */
    Map<EntryCategory, Long> counts();

    /**
     * Verifies the store is operational.
     */
    boolean healthCheck();

    @Override
    void close();
}
