package io.agentbridge.bridge;

import io.agentbridge.memory.EntryCategory;
import io.agentbridge.memory.MemoryEntry;

/**
 * Maps a subsystem's native object to an entry and back.
 *
 * <p>{@link #toEntry} is deterministic: the same input yields the same entry ({@code createdAt}
 * is left unset and assigned on write). {@link #fromEntry} restores every field the consuming
 * side reads.</p>
 *
 * @param <T> native type
 */
public interface BridgeAdapter<T> {

    /**
     * @throws IllegalArgumentException if the adapter does not handle the category
     */
    MemoryEntry toEntry(T value, EntryCategory category);

    /**
     * @throws IllegalArgumentException if the entry was not produced by this adapter
     */
    T fromEntry(MemoryEntry entry);

    boolean supports(EntryCategory category);
}
