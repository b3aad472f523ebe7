package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.infrastructure.adapter.mapper.WeatherMapper;
import com.cityexplorer.backend.infrastructure.config.ProviderProperties;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

@Component
public class WeatherProviderClient extends UpstreamClient {

    private final WeatherApi weatherApi;
    private final WeatherMapper weatherMapper;
    private final ProviderProperties properties;

    public WeatherProviderClient(WeatherApi weatherApi, WeatherMapper weatherMapper, ProviderProperties properties) {
        super("weather");
        this.weatherApi = weatherApi;
        this.weatherMapper = weatherMapper;
        this.properties = properties;
    }

    @TimeLimiter(name = "weather")
    public CompletableFuture<List<Map<String, Object>>> fetchForecast(double latitude, double longitude) {
        return fetch(() -> weatherApi.forecast(properties.getWeather().getApiKey(), latitude, longitude),
                body -> body.daily() == null
                        ? List.of()
                        : weatherMapper.mapToForecasts(orEmpty(body.daily().data())));
    }
}
