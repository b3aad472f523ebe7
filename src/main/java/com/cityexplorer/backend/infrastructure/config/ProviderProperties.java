package com.cityexplorer.backend.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Endpoints and credentials of the upstream data providers
 */
@Component
@ConfigurationProperties(prefix = "cityexplorer.providers")
public class ProviderProperties {

    private Provider geocode = new Provider();
    private Provider weather = new Provider();
    private Provider events = new Provider();
    private Provider movies = new Provider();
    private Provider yelp = new Provider();

    public Provider getGeocode() {
        return geocode;
    }

    public void setGeocode(Provider geocode) {
        this.geocode = geocode;
    }

    public Provider getWeather() {
        return weather;
    }

    public void setWeather(Provider weather) {
        this.weather = weather;
    }

    public Provider getEvents() {
        return events;
    }

    public void setEvents(Provider events) {
        this.events = events;
    }

    public Provider getMovies() {
        return movies;
    }

    public void setMovies(Provider movies) {
        this.movies = movies;
    }

    public Provider getYelp() {
        return yelp;
    }

    public void setYelp(Provider yelp) {
        this.yelp = yelp;
    }

    public static class Provider {

        private String baseUrl;
        private String apiKey;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }
}
