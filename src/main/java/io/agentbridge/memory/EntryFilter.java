package io.agentbridge.memory;

import java.time.Instant;

/**
 * Optional constraints for {@link DurableStore#list}. Null fields are ignored.
 *
 * @param source        only entries from this side
 * @param since         only entries created at or after this instant
 * @param keyPrefix     only keys starting with this prefix
 * @param minConfidence only entries whose confidence is at least this value
 * @param limit         maximum number of results
 */
public record EntryFilter(
        EntrySource source,
        Instant since,
        String keyPrefix,
        Double minConfidence,
        int limit
) {
    public static final int DEFAULT_LIMIT = 100;

    public EntryFilter {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static EntryFilter all() {
        return new EntryFilter(null, null, null, null, DEFAULT_LIMIT);
    }

    public static EntryFilter latest(String keyPrefix) {
        return new EntryFilter(null, null, keyPrefix, null, 1);
    }

    public EntryFilter withSource(EntrySource source) {
        return new EntryFilter(source, since, keyPrefix, minConfidence, limit);
    }

    public EntryFilter withSince(Instant since) {
        return new EntryFilter(source, since, keyPrefix, minConfidence, limit);
    }

    public EntryFilter withKeyPrefix(String keyPrefix) {
        return new EntryFilter(source, since, keyPrefix, minConfidence, limit);
    }

    public EntryFilter withMinConfidence(Double minConfidence) {
        return new EntryFilter(source, since, keyPrefix, minConfidence, limit);
    }

    public EntryFilter withLimit(int limit) {
        return new EntryFilter(source, since, keyPrefix, minConfidence, limit);
    }
}
