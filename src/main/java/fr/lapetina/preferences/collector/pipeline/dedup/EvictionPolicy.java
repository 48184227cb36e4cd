package fr.lapetina.preferences.collector.pipeline.dedup;

import java.util.Locale;
import java.util.Optional;

/**
 * How {@link DeduplicationCache} makes room once it is full.
 */
public enum EvictionPolicy {

    /** Drop the least recently seen hash, one per insertion. Hits refresh recency. */
    LRU,

    /** Drop the older half of the entries (insertion order) in one sweep. */
    HALF;

    /**
     * Resolves a configuration name ("lru", "half").
     */
    public static Optional<EvictionPolicy> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "lru" -> Optional.of(LRU);
            case "half", "remove-half" -> Optional.of(HALF);
            default -> Optional.empty();
        };
    }
}
