package com.cityexplorer.backend.infrastructure.adapter.provider.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ForecastJson(
        DailyJson daily
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DailyJson(
            List<DayJson> data
    ) {}

    /**
     * One forecast day; {@code time} is in epoch seconds.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DayJson(
            String summary,
            long time
    ) {}
}
