package com.cityexplorer.backend.application;

/**
 * Resolution counters
 */
public record CacheStats(
        long hits,
        long misses,
        long evictions,
        long upstreamFetches,
        long errors
) {
    public double hitRatio() {
        long total = hits + misses + evictions;
        return total > 0 ? (double) hits / total : 0.0;
    }

    public String summary() {
        return String.format("Hit ratio: %.1f%%, Upstream fetches: %d, Errors: %d",
                hitRatio() * 100, upstreamFetches, errors);
    }
}
