package com.cityexplorer.backend.domain.model;

import java.util.List;

/**
 * Outcome of judging a lookup result against its resource's TTL.
 */
public record FreshnessVerdict(Status status, List<CachedRow> rows) {

    public enum Status {
        FRESH,
        MISS,
        EVICTED
    }

    private static final FreshnessVerdict MISS = new FreshnessVerdict(Status.MISS, List.of());
    private static final FreshnessVerdict EVICTED = new FreshnessVerdict(Status.EVICTED, List.of());

    public FreshnessVerdict {
        rows = List.copyOf(rows);
    }

    public static FreshnessVerdict fresh(List<CachedRow> rows) {
        return new FreshnessVerdict(Status.FRESH, rows);
    }

    public static FreshnessVerdict miss() {
        return MISS;
    }

    public static FreshnessVerdict evicted() {
        return EVICTED;
    }

    public boolean isFresh() {
        return status == Status.FRESH;
    }
}
