package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.infrastructure.adapter.mapper.MovieMapper;
import com.cityexplorer.backend.infrastructure.config.ProviderProperties;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

@Component
public class MovieProviderClient extends UpstreamClient {

    private final MovieApi movieApi;
    private final MovieMapper movieMapper;
    private final ProviderProperties properties;

    public MovieProviderClient(MovieApi movieApi, MovieMapper movieMapper, ProviderProperties properties) {
        super("tmdb");
        this.movieApi = movieApi;
        this.movieMapper = movieMapper;
        this.properties = properties;
    }

    @TimeLimiter(name = "movies")
    public CompletableFuture<List<Map<String, Object>>> fetchMovies(String query) {
        return fetch(() -> movieApi.searchMovies(properties.getMovies().getApiKey(), query),
                body -> movieMapper.mapToMovies(orEmpty(body.results())));
    }
}
