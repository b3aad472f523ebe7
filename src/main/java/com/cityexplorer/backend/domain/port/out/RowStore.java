package com.cityexplorer.backend.domain.port.out;

import com.cityexplorer.backend.domain.model.CacheKey;
import com.cityexplorer.backend.domain.model.CachedRow;
import com.cityexplorer.backend.domain.model.ResourcePolicy;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Repository port for cached rows, generic over every registered resource type.
 * Table and column names are taken from the {@link ResourcePolicy} only, never from callers.
 */
public interface RowStore {

    /**
     * Rows stored under the key, ordered by id. Empty when nothing matches.
     *
     * @throws com.cityexplorer.backend.domain.exception.StoreReadException if the query fails
     */
    List<CachedRow> findByKey(ResourcePolicy policy, CacheKey key);

    /**
     * Persist one normalized record under the key.
     *
     * @param fields canonical field values; names must belong to {@code policy.fields()}
     * @return the stored row, carrying its store-assigned id
     * @throws com.cityexplorer.backend.domain.exception.StoreWriteException on constraint
     *         violation or connectivity failure
     */
    CachedRow insert(ResourcePolicy policy, CacheKey key, Map<String, Object> fields, Instant createdAt);

    /**
     * Remove every row stored under the key. Deleting an absent key is a no-op.
     *
     * @return number of rows removed
     */
    int deleteByKey(ResourcePolicy policy, CacheKey key);
}
