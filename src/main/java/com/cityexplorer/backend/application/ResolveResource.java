package com.cityexplorer.backend.application;

import com.cityexplorer.backend.domain.model.CacheKey;
import com.cityexplorer.backend.domain.model.CachedRow;
import com.cityexplorer.backend.domain.port.out.ResourceFetcher;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Cache-aside entry point used by the routing layer.
 */
public interface ResolveResource {

    /**
     * Returns the rows cached for the key when they are still fresh; otherwise fetches the
     * resource through {@code fetcher}, stores the normalized records and returns them.
     *
     * @param resourceType registered resource type name
     * @param key lookup key, of the kind the resource is keyed by
     * @param fetcher provider and normalizer for this resource, invoked at most once
     * @return a future completing with the rows, or failing with
     *         {@link com.cityexplorer.backend.domain.exception.UnknownResourceException},
     *         {@link com.cityexplorer.backend.domain.exception.NoDataAvailableException},
     *         {@link com.cityexplorer.backend.domain.exception.UpstreamUnavailableException},
     *         {@link com.cityexplorer.backend.domain.exception.StoreReadException} or
     *         {@link com.cityexplorer.backend.domain.exception.StoreWriteException}
     */
    CompletableFuture<List<CachedRow>> resolve(String resourceType, CacheKey key, ResourceFetcher fetcher);

    /**
     * Counters collected since startup.
     */
    CacheStats getStats();
}
