package com.cityexplorer.backend.infrastructure.config;

import com.cityexplorer.backend.infrastructure.adapter.provider.EventbriteApi;
import com.cityexplorer.backend.infrastructure.adapter.provider.GeocodeApi;
import com.cityexplorer.backend.infrastructure.adapter.provider.MovieApi;
import com.cityexplorer.backend.infrastructure.adapter.provider.WeatherApi;
import com.cityexplorer.backend.infrastructure.adapter.provider.YelpApi;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

@Configuration
public class RetrofitProviderConfig {

    private final ProviderProperties properties;
    private final ObjectMapper providerMapper;

    public RetrofitProviderConfig(ProviderProperties properties) {
        this.properties = properties;
        this.providerMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public GeocodeApi geocodeApi() {
        return create(properties.getGeocode(), GeocodeApi.class);
    }

    @Bean
    public WeatherApi weatherApi() {
        return create(properties.getWeather(), WeatherApi.class);
    }

    @Bean
    public EventbriteApi eventbriteApi() {
        return create(properties.getEvents(), EventbriteApi.class);
    }

    @Bean
    public MovieApi movieApi() {
        return create(properties.getMovies(), MovieApi.class);
    }

    @Bean
    public YelpApi yelpApi() {
        return create(properties.getYelp(), YelpApi.class);
    }

    private <T> T create(ProviderProperties.Provider provider, Class<T> api) {
        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(provider.getBaseUrl())
                .addConverterFactory(JacksonConverterFactory.create(providerMapper))
                .build();

        return retrofit.create(api);
    }
}
