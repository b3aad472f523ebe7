package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.infrastructure.adapter.mapper.EventMapper;
import com.cityexplorer.backend.infrastructure.config.ProviderProperties;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

@Component
public class EventbriteProviderClient extends UpstreamClient {

    private final EventbriteApi eventbriteApi;
    private final EventMapper eventMapper;
    private final ProviderProperties properties;

    public EventbriteProviderClient(EventbriteApi eventbriteApi, EventMapper eventMapper, ProviderProperties properties) {
        super("eventbrite");
        this.eventbriteApi = eventbriteApi;
        this.eventMapper = eventMapper;
        this.properties = properties;
    }

    @TimeLimiter(name = "events")
    public CompletableFuture<List<Map<String, Object>>> fetchEvents(double latitude, double longitude) {
        return fetch(() -> eventbriteApi.searchEvents(properties.getEvents().getApiKey(), latitude, longitude),
                body -> eventMapper.mapToEvents(orEmpty(body.events())));
    }
}
