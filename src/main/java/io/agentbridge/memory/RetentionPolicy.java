package io.agentbridge.memory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * How long durable entries are kept. A category without a horizon is never
 * swept by age; a non-positive {@code maxEntriesPerCategory} disables the count bound.
 *
 * <p>Unprocessed events outlive the event horizon so a late consumer can still reconcile,
 * up to {@code pendingEventMaxAge} (null keeps them until the count bound removes them).</p>
 */
public record RetentionPolicy(Map<EntryCategory, Duration> maxAge, int maxEntriesPerCategory,
                              Duration pendingEventMaxAge) {

    public RetentionPolicy {
        maxAge = maxAge == null || maxAge.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(maxAge));
        if (pendingEventMaxAge != null && (pendingEventMaxAge.isZero() || pendingEventMaxAge.isNegative())) {
            throw new IllegalArgumentException("pendingEventMaxAge must be positive: " + pendingEventMaxAge);
        }
    }

    public RetentionPolicy(Map<EntryCategory, Duration> maxAge, int maxEntriesPerCategory) {
        this(maxAge, maxEntriesPerCategory, null);
    }

    /**
     * Same horizon for every category.
     */
    public static RetentionPolicy keepFor(Duration horizon, int maxEntriesPerCategory) {
        return keepFor(horizon, maxEntriesPerCategory, null);
    }

    public static RetentionPolicy keepFor(Duration horizon, int maxEntriesPerCategory, Duration pendingEventMaxAge) {
        Map<EntryCategory, Duration> ages = new EnumMap<>(EntryCategory.class);
        for (EntryCategory category : EntryCategory.values()) {
            ages.put(category, horizon);
        }
        return new RetentionPolicy(ages, maxEntriesPerCategory, pendingEventMaxAge);
    }

    public Duration horizonFor(EntryCategory category) {
        return maxAge.get(category);
    }

    public boolean isCountBounded() {
        return maxEntriesPerCategory > 0;
    }
}
