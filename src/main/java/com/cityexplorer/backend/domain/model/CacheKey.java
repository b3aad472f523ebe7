package com.cityexplorer.backend.domain.model;

import java.util.Objects;

/**
 * Lookup key for cached rows: either a search string or a location id.
 * The kind must match the {@link KeyKind} of the resource it is used with.
 */
public record CacheKey(KeyKind kind, Object value) {

    public CacheKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        if (kind == KeyKind.SEARCH_QUERY && !(value instanceof String)) {
            throw new IllegalArgumentException("Search query key must be a string: " + value);
        }
        if (kind == KeyKind.LOCATION_ID && !(value instanceof Long)) {
            throw new IllegalArgumentException("Location id key must be a long: " + value);
        }
    }

    public static CacheKey searchQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be blank");
        }
        return new CacheKey(KeyKind.SEARCH_QUERY, query);
    }

    public static CacheKey locationId(long locationId) {
        return new CacheKey(KeyKind.LOCATION_ID, locationId);
    }

    public String column() {
        return kind.column();
    }

    @Override
    public String toString() {
        return kind.column() + "=" + value;
    }
}
