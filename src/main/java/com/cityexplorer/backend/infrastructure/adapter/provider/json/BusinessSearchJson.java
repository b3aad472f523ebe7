package com.cityexplorer.backend.infrastructure.adapter.provider.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BusinessSearchJson(
        List<BusinessJson> businesses
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BusinessJson(
            String name,

            @JsonProperty("image_url")
            String imageUrl,

            String price,

            Double rating,

            String url
    ) {}
}
