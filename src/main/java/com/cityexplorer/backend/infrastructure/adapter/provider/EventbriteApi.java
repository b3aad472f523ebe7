package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.infrastructure.adapter.provider.json.EventSearchJson;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Query;

public interface EventbriteApi {

    @GET("v3/events/search/")
    Call<EventSearchJson> searchEvents(@Query("token") String token,
                                       @Query("location.latitude") double latitude,
                                       @Query("location.longitude") double longitude);
}
