package com.can.ringcache.core;

/**
 * Snapshot of a {@link LocalCache}'s counters and bounds.
 *
 * @param overLimit true while the stored bytes exceed the memory limit, which only
 *                  happens after a single entry larger than the limit was stored
 */
public record CacheStats(
        long hits,
        long misses,
        long sets,
        long deletes,
        long evictions,
        long expirations,
        long errors,
        int size,
        int maxSize,
        long memoryUsed,
        long memoryLimit,
        String evictionPolicy,
        boolean overLimit
) {
    public double hitRatio()
    {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }

    public String summary()
    {
        return String.format("size=%d/%d memory=%d/%d hitRatio=%.1f%% evictions=%d expirations=%d policy=%s%s",
                size, maxSize, memoryUsed, memoryLimit, hitRatio() * 100, evictions, expirations, evictionPolicy,
                overLimit ? " OVER_LIMIT" : "");
    }
}
