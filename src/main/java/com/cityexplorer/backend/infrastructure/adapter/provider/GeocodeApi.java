package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.infrastructure.adapter.provider.json.GeocodeJson;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Query;

/**
 * Google Geocoding API.
 */
public interface GeocodeApi {

    @GET("maps/api/geocode/json")
    Call<GeocodeJson> geocode(@Query("address") String address, @Query("key") String apiKey);
}
