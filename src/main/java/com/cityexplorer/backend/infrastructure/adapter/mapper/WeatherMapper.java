package com.cityexplorer.backend.infrastructure.adapter.mapper;

import com.cityexplorer.backend.infrastructure.adapter.provider.json.ForecastJson;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class WeatherMapper {

    /**
     * One row per forecast day
     */
    public List<Map<String, Object>> mapToForecasts(List<ForecastJson.DayJson> days) {
        return days.stream()
                .map(this::mapToForecast)
                .toList();
    }

    private Map<String, Object> mapToForecast(ForecastJson.DayJson day) {
        Map<String, Object> forecast = new LinkedHashMap<>();
        forecast.put("forecast", day.summary());
        forecast.put("time", DisplayDates.ofEpochSeconds(day.time()));
        return forecast;
    }
}
