package com.cityexplorer.backend.infrastructure.adapter.provider.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GeocodeJson(
        List<ResultJson> results
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResultJson(
            @JsonProperty("formatted_address")
            String formattedAddress,

            GeometryJson geometry
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeometryJson(
            LatLngJson location
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LatLngJson(
            double lat,
            double lng
    ) {}
}
