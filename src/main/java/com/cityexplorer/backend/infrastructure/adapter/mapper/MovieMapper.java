package com.cityexplorer.backend.infrastructure.adapter.mapper;

import com.cityexplorer.backend.infrastructure.adapter.provider.json.MovieSearchJson;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class MovieMapper {

    static final String POSTER_BASE_URL = "https://image.tmdb.org/t/p/original";
    static final int MAX_OVERVIEW_LENGTH = 750;

    public List<Map<String, Object>> mapToMovies(List<MovieSearchJson.MovieJson> movies) {
        return movies.stream()
                .map(this::mapToMovie)
                .toList();
    }

    private Map<String, Object> mapToMovie(MovieSearchJson.MovieJson movie) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("title", movie.originalTitle());
        row.put("overview", truncate(movie.overview()));
        row.put("average_votes", movie.voteAverage());
        row.put("total_votes", movie.voteCount());
        row.put("image_url", movie.posterPath() != null ? POSTER_BASE_URL + movie.posterPath() : null);
        row.put("popularity", movie.popularity());
        row.put("released_on", movie.releaseDate());
        return row;
    }

    private String truncate(String overview) {
        if (overview == null || overview.length() <= MAX_OVERVIEW_LENGTH) {
            return overview;
        }
        return overview.substring(0, MAX_OVERVIEW_LENGTH);
    }
}
