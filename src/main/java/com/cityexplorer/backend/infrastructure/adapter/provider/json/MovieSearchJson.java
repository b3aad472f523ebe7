package com.cityexplorer.backend.infrastructure.adapter.provider.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MovieSearchJson(
        List<MovieJson> results
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MovieJson(
            @JsonProperty("original_title")
            String originalTitle,

            String overview,

            @JsonProperty("vote_average")
            Double voteAverage,

            @JsonProperty("vote_count")
            Integer voteCount,

            @JsonProperty("poster_path")
            String posterPath,

            Double popularity,

            @JsonProperty("release_date")
            String releaseDate
    ) {}
}
