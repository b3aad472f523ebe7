package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.infrastructure.adapter.provider.json.BusinessSearchJson;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Header;
import retrofit2.http.Query;

public interface YelpApi {

    @GET("v3/businesses/search")
    Call<BusinessSearchJson> searchBusinesses(@Header("Authorization") String authorization,
                                              @Query("latitude") double latitude,
                                              @Query("longitude") double longitude);
}
