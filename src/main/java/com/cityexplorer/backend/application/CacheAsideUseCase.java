package com.cityexplorer.backend.application;

import com.cityexplorer.backend.domain.FreshnessEvaluator;
import com.cityexplorer.backend.domain.ResourceRegistry;
import com.cityexplorer.backend.domain.exception.NoDataAvailableException;
import com.cityexplorer.backend.domain.exception.NoUpstreamDataException;
import com.cityexplorer.backend.domain.exception.UpstreamUnavailableException;
import com.cityexplorer.backend.domain.model.CacheKey;
import com.cityexplorer.backend.domain.model.CachedRow;
import com.cityexplorer.backend.domain.model.FreshnessVerdict;
import com.cityexplorer.backend.domain.model.ResourcePolicy;
import com.cityexplorer.backend.domain.port.out.ResourceFetcher;
import com.cityexplorer.backend.domain.port.out.RowStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Cache-aside orchestration: lookup, freshness check, then either the cached rows or
 * exactly one upstream fetch whose normalized records are persisted and returned.
 * <p>
 * Store work runs on {@code asyncExecutor}. Concurrent misses on the same key are not
 * serialized and may each fetch and insert.
 */
@Service
public class CacheAsideUseCase implements ResolveResource {

    private static final Logger logger = LoggerFactory.getLogger(CacheAsideUseCase.class);

    private final ResourceRegistry registry;
    private final RowStore rowStore;
    private final FreshnessEvaluator freshnessEvaluator;
    private final Executor executor;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong upstreamFetches = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public CacheAsideUseCase(ResourceRegistry registry,
                             RowStore rowStore,
                             FreshnessEvaluator freshnessEvaluator,
                             @Qualifier("asyncExecutor") Executor executor,
                             Clock clock) {
        this.registry = registry;
        this.rowStore = rowStore;
        this.freshnessEvaluator = freshnessEvaluator;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<List<CachedRow>> resolve(String resourceType, CacheKey key, ResourceFetcher fetcher) {
        ResourcePolicy policy;
        try {
            policy = registry.policyFor(resourceType);
            if (!policy.accepts(key)) {
                throw new IllegalArgumentException(
                        resourceType + " is keyed by " + policy.keyKind() + ", got " + key.kind());
            }
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<List<CachedRow>> result = CompletableFuture
                .supplyAsync(() -> rowStore.findByKey(policy, key), executor)
                .thenApplyAsync(rows -> freshnessEvaluator.evaluate(policy, rows, key), executor)
                .thenCompose(verdict -> onVerdict(policy, key, verdict, fetcher));

        return result.whenComplete((rows, error) -> {
            // An empty upstream answer is an outcome, not a fault
            if (error != null && !(unwrap(error) instanceof NoDataAvailableException)) {
                errors.incrementAndGet();
            }
        });
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(hits.get(), misses.get(), evictions.get(), upstreamFetches.get(), errors.get());
    }

    private CompletableFuture<List<CachedRow>> onVerdict(ResourcePolicy policy,
                                                          CacheKey key,
                                                          FreshnessVerdict verdict,
                                                          ResourceFetcher fetcher) {
        if (verdict.isFresh()) {
            hits.incrementAndGet();
            logger.debug("Cache hit: {} rows of {} for [{}]", verdict.rows().size(), policy.resourceType(), key);
            return CompletableFuture.completedFuture(verdict.rows());
        }

        if (verdict.status() == FreshnessVerdict.Status.EVICTED) {
            evictions.incrementAndGet();
            logger.debug("Stale {} rows for [{}] evicted - fetching upstream", policy.resourceType(), key);
        } else {
            misses.incrementAndGet();
            logger.debug("Cache miss for {} [{}] - fetching upstream", policy.resourceType(), key);
        }
        return fetchAndStore(policy, key, fetcher);
    }

    private CompletableFuture<List<CachedRow>> fetchAndStore(ResourcePolicy policy, CacheKey key, ResourceFetcher fetcher) {
        upstreamFetches.incrementAndGet();

        CompletableFuture<List<Map<String, Object>>> fetched;
        try {
            fetched = fetcher.fetch(key);
        } catch (RuntimeException e) {
            fetched = CompletableFuture.failedFuture(e);
        }

        return fetched
                .handle((records, error) -> checkFetchResult(policy, key, records, error))
                .thenApplyAsync(records -> store(policy, key, records), executor);
    }

    private List<Map<String, Object>> checkFetchResult(ResourcePolicy policy,
                                                       CacheKey key,
                                                       List<Map<String, Object>> records,
                                                       Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof NoUpstreamDataException) {
            logger.info("Upstream has no {} data for [{}]", policy.resourceType(), key);
            throw new NoDataAvailableException(cause.getMessage(), cause);
        }
        if (cause != null) {
            logger.warn("Upstream fetch of {} for [{}] failed: {}", policy.resourceType(), key, cause.toString());
            throw new UpstreamUnavailableException(
                    "Failed to fetch " + policy.resourceType() + " for " + key, cause);
        }
        if (records == null || records.isEmpty()) {
            logger.info("Upstream returned no {} records for [{}]", policy.resourceType(), key);
            throw new NoDataAvailableException("No " + policy.resourceType() + " data for " + key, null);
        }
        return records;
    }

    private List<CachedRow> store(ResourcePolicy policy, CacheKey key, List<Map<String, Object>> records) {
        Instant createdAt = clock.instant();
        List<CachedRow> stored = new ArrayList<>(records.size());
        for (Map<String, Object> fields : records) {
            stored.add(rowStore.insert(policy, key, fields, createdAt));
        }
        logger.info("Stored {} fresh {} rows for [{}]", stored.size(), policy.resourceType(), key);
        return stored;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
