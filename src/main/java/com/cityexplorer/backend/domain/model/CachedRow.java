package com.cityexplorer.backend.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A persisted, normalized record. Exactly one of {@code locationKey} / {@code searchKey} is set.
 */
public record CachedRow(
        long id,
        Long locationKey,
        String searchKey,
        Map<String, Object> fields,
        Instant createdAt
) {
    public CachedRow {
        if ((locationKey == null) == (searchKey == null)) {
            throw new IllegalArgumentException("Exactly one of locationKey/searchKey must be set");
        }
        // Values may be null, so Map.copyOf is not an option
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static CachedRow of(long id, CacheKey key, Map<String, Object> fields, Instant createdAt) {
        return key.kind() == KeyKind.SEARCH_QUERY
                ? new CachedRow(id, null, (String) key.value(), fields, createdAt)
                : new CachedRow(id, (Long) key.value(), null, fields, createdAt);
    }

    public Object field(String name) {
        return fields.get(name);
    }
}
