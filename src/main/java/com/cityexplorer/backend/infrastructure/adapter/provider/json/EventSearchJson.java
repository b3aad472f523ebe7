package com.cityexplorer.backend.infrastructure.adapter.provider.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EventSearchJson(
        List<EventJson> events
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EventJson(
            String url,
            TextJson name,
            StartJson start,
            String summary
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TextJson(
            String text
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StartJson(
            String local
    ) {}
}
