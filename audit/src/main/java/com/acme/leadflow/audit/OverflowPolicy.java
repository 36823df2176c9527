package com.acme.leadflow.audit;

/**
 * What a bounded write queue does when it is full.
 */
public enum OverflowPolicy {
    /** Reject the incoming event. */
    DROP_NEWEST,
    /** Evict the oldest queued event to make room. */
    DROP_OLDEST;

    public static OverflowPolicy parse(String raw, OverflowPolicy fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return switch (raw.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "drop_oldest", "drop-oldest", "oldest" -> DROP_OLDEST;
            case "drop_newest", "drop-newest", "newest" -> DROP_NEWEST;
            default -> fallback;
        };
    }
}
