package com.cityexplorer.backend.domain;

import com.cityexplorer.backend.domain.model.CacheKey;
import com.cityexplorer.backend.domain.model.CachedRow;
import com.cityexplorer.backend.domain.model.FreshnessVerdict;
import com.cityexplorer.backend.domain.model.ResourcePolicy;
import com.cityexplorer.backend.domain.port.out.RowStore;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether the rows stored under a key are still usable.
 * <p>
 * All rows of a key form one unit: the first row's age decides for the whole group and
 * stale groups are deleted together. Eviction happens only on access.
 */
public class FreshnessEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FreshnessEvaluator.class);

    private final RowStore rowStore;
    private final Clock clock;

    public FreshnessEvaluator(RowStore rowStore, Clock clock) {
        this.rowStore = rowStore;
        this.clock = clock;
    }

    public FreshnessVerdict evaluate(ResourcePolicy policy, List<CachedRow> rows, CacheKey key) {
        if (rows.isEmpty()) {
            return FreshnessVerdict.miss();
        }

        long age = clock.millis() - rows.get(0).createdAt().toEpochMilli();
        logger.debug("{} [{}] age: {}ms, ttl: {}ms", policy.resourceType(), key, age, policy.ttlMillis());

        if (age <= policy.ttlMillis()) {
            return FreshnessVerdict.fresh(rows);
        }

        evict(policy, key);
        return FreshnessVerdict.evicted();
    }

    private void evict(ResourcePolicy policy, CacheKey key) {
        try {
            int deleted = rowStore.deleteByKey(policy, key);
            logger.debug("Evicted {} stale {} rows for [{}]", deleted, policy.resourceType(), key);
        } catch (Exception e) {
            // Left for the next lookup to evict again
            logger.warn("Failed to evict stale {} rows for [{}]: {}", policy.resourceType(), key, e.getMessage());
        }
    }
}
