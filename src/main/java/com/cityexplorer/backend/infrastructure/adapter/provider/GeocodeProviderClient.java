package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.infrastructure.adapter.mapper.LocationMapper;
import com.cityexplorer.backend.infrastructure.config.ProviderProperties;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

@Component
public class GeocodeProviderClient extends UpstreamClient {

    private final GeocodeApi geocodeApi;
    private final LocationMapper locationMapper;
    private final ProviderProperties properties;

    public GeocodeProviderClient(GeocodeApi geocodeApi, LocationMapper locationMapper, ProviderProperties properties) {
        super("geocode");
        this.geocodeApi = geocodeApi;
        this.locationMapper = locationMapper;
        this.properties = properties;
    }

    @TimeLimiter(name = "geocode")
    public CompletableFuture<List<Map<String, Object>>> fetchLocation(String query) {
        return fetch(() -> geocodeApi.geocode(query, properties.getGeocode().getApiKey()),
                body -> locationMapper.mapToLocations(orEmpty(body.results())));
    }
}
