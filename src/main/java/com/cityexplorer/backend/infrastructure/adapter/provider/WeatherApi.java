package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.infrastructure.adapter.provider.json.ForecastJson;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Path;

/**
 * Dark Sky forecast API. The API key is part of the path.
 */
public interface WeatherApi {

    @GET("forecast/{key}/{latitude},{longitude}")
    Call<ForecastJson> forecast(@Path("key") String apiKey,
                                @Path("latitude") double latitude,
                                @Path("longitude") double longitude);
}
