package com.cityexplorer.backend.domain.port.out;

import com.cityexplorer.backend.domain.model.CacheKey;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Provider plus normalizer for one resource type: fetches upstream data for a key and
 * returns it as canonical field maps.
 * <p>
 * The future fails with {@link com.cityexplorer.backend.domain.exception.NoUpstreamDataException}
 * when the provider has nothing for the key, and with any other exception when the call failed.
 */
@FunctionalInterface
public interface ResourceFetcher {

    CompletableFuture<List<Map<String, Object>>> fetch(CacheKey key);
}
