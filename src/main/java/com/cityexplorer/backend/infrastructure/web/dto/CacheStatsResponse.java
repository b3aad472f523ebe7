package com.cityexplorer.backend.infrastructure.web.dto;

import com.cityexplorer.backend.application.CacheStats;

public record CacheStatsResponse(
        long hits,
        long misses,
        long evictions,
        long upstream_fetches,
        long errors,
        double hit_ratio,
        String summary
) {
    public static CacheStatsResponse fromStats(CacheStats stats) {
        return new CacheStatsResponse(
                stats.hits(),
                stats.misses(),
                stats.evictions(),
                stats.upstreamFetches(),
                stats.errors(),
                stats.hitRatio(),
                stats.summary()
        );
    }
}
