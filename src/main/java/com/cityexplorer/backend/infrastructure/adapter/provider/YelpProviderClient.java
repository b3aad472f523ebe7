package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.infrastructure.adapter.mapper.BusinessMapper;
import com.cityexplorer.backend.infrastructure.config.ProviderProperties;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

@Component
public class YelpProviderClient extends UpstreamClient {

    private final YelpApi yelpApi;
    private final BusinessMapper businessMapper;
    private final ProviderProperties properties;

    public YelpProviderClient(YelpApi yelpApi, BusinessMapper businessMapper, ProviderProperties properties) {
        super("yelp");
        this.yelpApi = yelpApi;
        this.businessMapper = businessMapper;
        this.properties = properties;
    }

    @TimeLimiter(name = "yelp")
    public CompletableFuture<List<Map<String, Object>>> fetchBusinesses(double latitude, double longitude) {
        return fetch(() -> yelpApi.searchBusinesses("Bearer " + properties.getYelp().getApiKey(), latitude, longitude),
                body -> businessMapper.mapToBusinesses(orEmpty(body.businesses())));
    }
}
