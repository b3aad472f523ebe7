package com.cityexplorer.backend.infrastructure.web;

import com.cityexplorer.backend.application.ResolveResource;
import com.cityexplorer.backend.domain.ResourceRegistry;
import com.cityexplorer.backend.domain.exception.NoDataAvailableException;
import com.cityexplorer.backend.domain.exception.UpstreamUnavailableException;
import com.cityexplorer.backend.domain.model.CacheKey;
import com.cityexplorer.backend.domain.port.out.ResourceFetcher;
import com.cityexplorer.backend.infrastructure.adapter.provider.EventbriteProviderClient;
import com.cityexplorer.backend.infrastructure.adapter.provider.GeocodeProviderClient;
import com.cityexplorer.backend.infrastructure.adapter.provider.MovieProviderClient;
import com.cityexplorer.backend.infrastructure.adapter.provider.WeatherProviderClient;
import com.cityexplorer.backend.infrastructure.adapter.provider.YelpProviderClient;
import com.cityexplorer.backend.infrastructure.web.dto.CacheStatsResponse;
import com.cityexplorer.backend.infrastructure.web.dto.CachedRowResponse;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Routes each resource endpoint to the cache-aside resolver with the matching provider.
 * Location-dependent endpoints receive the location row's id and coordinates as
 * {@code data[...]} query parameters. Parameter constraints are checked by Spring MVC's
 * method validation and answered with 400.
 */
@RestController
@CrossOrigin
public class CityExplorerController {

    private static final Logger logger = LoggerFactory.getLogger(CityExplorerController.class);

    private final ResolveResource resolveResource;
    private final GeocodeProviderClient geocodeClient;
    private final WeatherProviderClient weatherClient;
    private final EventbriteProviderClient eventbriteClient;
    private final MovieProviderClient movieClient;
    private final YelpProviderClient yelpClient;

    public CityExplorerController(ResolveResource resolveResource,
                                  GeocodeProviderClient geocodeClient,
                                  WeatherProviderClient weatherClient,
                                  EventbriteProviderClient eventbriteClient,
                                  MovieProviderClient movieClient,
                                  YelpProviderClient yelpClient) {
        this.resolveResource = resolveResource;
        this.geocodeClient = geocodeClient;
        this.weatherClient = weatherClient;
        this.eventbriteClient = eventbriteClient;
        this.movieClient = movieClient;
        this.yelpClient = yelpClient;
    }

    @GetMapping("/location")
    public CompletableFuture<ResponseEntity<CachedRowResponse>> getLocation(@RequestParam("data") @NotBlank String query) {
        logger.info("Resolving location for '{}'", query);

        return resolveResource.resolve(ResourceRegistry.LOCATIONS, CacheKey.searchQuery(query),
                        key -> geocodeClient.fetchLocation(query))
                .thenApply(rows -> ResponseEntity.ok(CachedRowResponse.fromRow(rows.get(0))))
                .exceptionally(error -> {
                    Throwable cause = unwrap(error);
                    if (cause instanceof NoDataAvailableException) {
                        logger.info("No location found for '{}'", query);
                        return ResponseEntity.noContent().build();
                    }
                    return ResponseEntity.status(failureStatus(ResourceRegistry.LOCATIONS, cause)).build();
                });
    }

    @GetMapping("/weather")
    public CompletableFuture<ResponseEntity<List<CachedRowResponse>>> getWeather(
            @RequestParam("data[id]") long locationId,
            @RequestParam("data[latitude]") @DecimalMin("-90.0") @DecimalMax("90.0") double latitude,
            @RequestParam("data[longitude]") @DecimalMin("-180.0") @DecimalMax("180.0") double longitude) {
        return resolveRows(ResourceRegistry.WEATHER, locationId,
                key -> weatherClient.fetchForecast(latitude, longitude));
    }

    @GetMapping("/events")
    public CompletableFuture<ResponseEntity<List<CachedRowResponse>>> getEvents(
            @RequestParam("data[id]") long locationId,
            @RequestParam("data[latitude]") @DecimalMin("-90.0") @DecimalMax("90.0") double latitude,
            @RequestParam("data[longitude]") @DecimalMin("-180.0") @DecimalMax("180.0") double longitude) {
        return resolveRows(ResourceRegistry.EVENTS, locationId,
                key -> eventbriteClient.fetchEvents(latitude, longitude));
    }

    @GetMapping("/movies")
    public CompletableFuture<ResponseEntity<List<CachedRowResponse>>> getMovies(
            @RequestParam("data[id]") long locationId,
            @RequestParam("data[search_query]") @NotBlank String searchQuery) {
        return resolveRows(ResourceRegistry.MOVIES, locationId,
                key -> movieClient.fetchMovies(searchQuery));
    }

    @GetMapping("/yelp")
    public CompletableFuture<ResponseEntity<List<CachedRowResponse>>> getYelp(
            @RequestParam("data[id]") long locationId,
            @RequestParam("data[latitude]") @DecimalMin("-90.0") @DecimalMax("90.0") double latitude,
            @RequestParam("data[longitude]") @DecimalMin("-180.0") @DecimalMax("180.0") double longitude) {
        return resolveRows(ResourceRegistry.YELP, locationId,
                key -> yelpClient.fetchBusinesses(latitude, longitude));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStatsResponse> getCacheStats() {
        return ResponseEntity.ok(CacheStatsResponse.fromStats(resolveResource.getStats()));
    }

    private CompletableFuture<ResponseEntity<List<CachedRowResponse>>> resolveRows(String resourceType,
                                                                                 long locationId,
                                                                                 ResourceFetcher fetcher) {
        logger.info("Resolving {} for location {}", resourceType, locationId);

        return resolveResource.resolve(resourceType, CacheKey.locationId(locationId), fetcher)
                .thenApply(rows -> {
                    logger.debug("Returning {} {} rows for location {}", rows.size(), resourceType, locationId);
                    return ResponseEntity.ok(CachedRowResponse.fromRows(rows));
                })
                .exceptionally(error -> {
                    Throwable cause = unwrap(error);
                    if (cause instanceof NoDataAvailableException) {
                        logger.info("No {} data for location {}", resourceType, locationId);
                        return ResponseEntity.ok(List.of());
                    }
                    return ResponseEntity.status(failureStatus(resourceType, cause)).body(List.of());
                });
    }

    private HttpStatus failureStatus(String resourceType, Throwable cause) {
        if (cause instanceof UpstreamUnavailableException) {
            logger.warn("Upstream unavailable for {}: {}", resourceType, cause.getMessage());
            return HttpStatus.BAD_GATEWAY;
        }
        logger.error("Error resolving {}", resourceType, cause);
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
