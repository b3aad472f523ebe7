package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.infrastructure.adapter.provider.json.MovieSearchJson;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Query;

/**
 * TMDB movie search. Movies are looked up by the location's search text, first page only.
 */
public interface MovieApi {

    @GET("3/search/movie?language=en-US&page=1&include_adult=false")
    Call<MovieSearchJson> searchMovies(@Query("api_key") String apiKey, @Query("query") String query);
}
