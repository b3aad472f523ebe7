package com.cityexplorer.backend.domain;

import com.cityexplorer.backend.domain.exception.UnknownResourceException;
import com.cityexplorer.backend.domain.model.KeyKind;
import com.cityexplorer.backend.domain.model.ResourcePolicy;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ResourceRegistryTest {

    private final ResourceRegistry registry = ResourceRegistry.defaults();

    @Test
    void shouldRegisterAllFiveResourceTypes() {
        assertThat(registry.policies())
                .extracting(ResourcePolicy::resourceType)
                .containsExactly("locations", "weather", "events", "movies", "yelp");
    }

    @Test
    void shouldKeepRegistrationOrder() {
        ResourceRegistry reversed = new ResourceRegistry(List.of(
                ResourceRegistry.defaults().policyFor("yelp"),
                ResourceRegistry.defaults().policyFor("locations")));

        assertThat(reversed.policies())
                .extracting(ResourcePolicy::resourceType)
                .containsExactly("yelp", "locations");
    }

    @Test
    void shouldKeyLocationsBySearchQueryAndOthersByLocationId() {
        assertThat(registry.policyFor("locations").keyKind()).isEqualTo(KeyKind.SEARCH_QUERY);
        assertThat(registry.policyFor("weather").keyKind()).isEqualTo(KeyKind.LOCATION_ID);
        assertThat(registry.policyFor("events").keyKind()).isEqualTo(KeyKind.LOCATION_ID);
        assertThat(registry.policyFor("movies").keyKind()).isEqualTo(KeyKind.LOCATION_ID);
        assertThat(registry.policyFor("yelp").keyKind()).isEqualTo(KeyKind.LOCATION_ID);
    }

    @Test
    void shouldUseDefaultTtls() {
        assertThat(registry.policyFor("weather").ttlMillis()).isEqualTo(15_000L);
        assertThat(registry.policyFor("events").ttl()).isEqualTo(Duration.ofHours(6));
        assertThat(registry.policyFor("yelp").ttl()).isEqualTo(Duration.ofHours(24));
        assertThat(registry.policyFor("movies").ttl()).isEqualTo(Duration.ofDays(30));
    }

    @Test
    void shouldMapResourceTypesToTables() {
        assertThat(registry.policyFor("weather").tableName()).isEqualTo("weathers");
        assertThat(registry.policyFor("yelp").tableName()).isEqualTo("yelps");
        assertThat(registry.policyFor("locations").fields())
                .containsExactly("formatted_query", "latitude", "longitude");
    }

    @Test
    void shouldFailForUnknownResourceType() {
        assertThatThrownBy(() -> registry.policyFor("trails"))
                .isInstanceOf(UnknownResourceException.class)
                .hasMessageContaining("trails");

        assertThatThrownBy(() -> registry.policyFor(null))
                .isInstanceOf(UnknownResourceException.class);

        assertThat(registry.isRegistered("trails")).isFalse();
        assertThat(registry.isRegistered("weather")).isTrue();
    }

    @Test
    void shouldRejectDuplicateResourceTypes() {
        ResourcePolicy weather = registry.policyFor("weather");

        assertThatThrownBy(() -> new ResourceRegistry(List.of(weather, weather.withTtl(Duration.ofSeconds(1)))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void shouldRejectPoliciesThatCouldInjectSql() {
        assertThatThrownBy(() -> new ResourcePolicy("bad", Duration.ofSeconds(1), KeyKind.LOCATION_ID,
                "weathers; DROP TABLE locations", List.of("forecast")))
                .isInstanceOf(IllegalArgumentException.class);

        assertThatThrownBy(() -> new ResourcePolicy("bad", Duration.ofSeconds(1), KeyKind.LOCATION_ID,
                "weathers", List.of("forecast", "1=1 --")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNonPositiveTtlAndReservedColumns() {
        assertThatThrownBy(() -> new ResourcePolicy("bad", Duration.ZERO, KeyKind.LOCATION_ID,
                "weathers", List.of("forecast")))
                .isInstanceOf(IllegalArgumentException.class);

        assertThatThrownBy(() -> new ResourcePolicy("bad", Duration.ofSeconds(1), KeyKind.LOCATION_ID,
                "weathers", List.of("created_at")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
