package com.cityexplorer.backend.domain;

import com.cityexplorer.backend.domain.exception.UnknownResourceException;
import com.cityexplorer.backend.domain.model.KeyKind;
import com.cityexplorer.backend.domain.model.ResourcePolicy;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed table of the resource types the cache can serve.
 * Every table and column name used by the row store originates here.
 */
public class ResourceRegistry {

    public static final String LOCATIONS = "locations";
    public static final String WEATHER = "weather";
    public static final String EVENTS = "events";
    public static final String MOVIES = "movies";
    public static final String YELP = "yelp";

    private final Map<String, ResourcePolicy> policies;

    public ResourceRegistry(Collection<ResourcePolicy> policies) {
        Map<String, ResourcePolicy> byType = new LinkedHashMap<>();
        for (ResourcePolicy policy : policies) {
            if (byType.putIfAbsent(policy.resourceType(), policy) != null) {
                throw new IllegalArgumentException("Duplicate resource type: " + policy.resourceType());
            }
        }
        this.policies = Collections.unmodifiableMap(byType);
    }

    /**
     * Registry with the default TTLs of the five supported resources.
     */
    public static ResourceRegistry defaults() {
        return new ResourceRegistry(defaultPolicies());
    }

    public static List<ResourcePolicy> defaultPolicies() {
        return List.of(
                new ResourcePolicy(LOCATIONS, Duration.ofDays(30), KeyKind.SEARCH_QUERY, "locations",
                        List.of("formatted_query", "latitude", "longitude")),
                new ResourcePolicy(WEATHER, Duration.ofSeconds(15), KeyKind.LOCATION_ID, "weathers",
                        List.of("forecast", "time")),
                new ResourcePolicy(EVENTS, Duration.ofHours(6), KeyKind.LOCATION_ID, "events",
                        List.of("link", "name", "event_date", "summary")),
                new ResourcePolicy(MOVIES, Duration.ofDays(30), KeyKind.LOCATION_ID, "movies",
                        List.of("title", "overview", "average_votes", "total_votes", "image_url",
                                "popularity", "released_on")),
                new ResourcePolicy(YELP, Duration.ofHours(24), KeyKind.LOCATION_ID, "yelps",
                        List.of("name", "image_url", "price", "rating", "url"))
        );
    }

    public ResourcePolicy policyFor(String resourceType) {
        ResourcePolicy policy = resourceType == null ? null : policies.get(resourceType);
        if (policy == null) {
            throw new UnknownResourceException(resourceType);
        }
        return policy;
    }

    public boolean isRegistered(String resourceType) {
        return resourceType != null && policies.containsKey(resourceType);
    }

    /**
     * Policies in registration order
     */
    public Collection<ResourcePolicy> policies() {
        return policies.values();
    }
}
