package io.agentbridge.bridge;

/**
 * Entry key convention: {@code {instrument_or_agent_id}:{subtype}:{timestamp_or_sequence}}.
 */
public final class EntryKeys {

    private static final String SEPARATOR = ":";

    private EntryKeys() {
    }

    public static String of(String id, String subtype, Object sequence) {
        return prefix(id, subtype) + sequence;
    }

    /**
     * Prefix shared by every key of one id and subtype, for {@code readLatest} and listing.
     */
    public static String prefix(String id, String subtype) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Key id must not be blank");
        }
        if (subtype == null || subtype.isBlank()) {
            throw new IllegalArgumentException("Key subtype must not be blank");
        }
        return id + SEPARATOR + subtype + SEPARATOR;
    }
}
