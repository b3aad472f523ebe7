package com.cityexplorer.backend.domain.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Caching policy of one resource type: how long its rows stay fresh, how they are keyed
 * and where they live.
 * <p>
 * Table and field names end up in SQL text, so they are restricted to plain identifiers here.
 */
public record ResourcePolicy(
        String resourceType,
        Duration ttl,
        KeyKind keyKind,
        String tableName,
        List<String> fields
) {
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]*");

    public ResourcePolicy {
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(keyKind, "keyKind");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive for " + resourceType + ": " + ttl);
        }
        requireIdentifier(tableName);
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Resource " + resourceType + " declares no fields");
        }
        fields.forEach(ResourcePolicy::requireIdentifier);
        if (fields.contains("id") || fields.contains("created_at")
                || fields.contains(KeyKind.SEARCH_QUERY.column()) || fields.contains(KeyKind.LOCATION_ID.column())) {
            throw new IllegalArgumentException("Resource " + resourceType + " redeclares a reserved column");
        }
        fields = List.copyOf(fields);
    }

    public long ttlMillis() {
        return ttl.toMillis();
    }

    public ResourcePolicy withTtl(Duration newTtl) {
        return new ResourcePolicy(resourceType, newTtl, keyKind, tableName, fields);
    }

    public boolean accepts(CacheKey key) {
        return key.kind() == keyKind;
    }

    private static void requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid SQL identifier: " + name);
        }
    }
}
