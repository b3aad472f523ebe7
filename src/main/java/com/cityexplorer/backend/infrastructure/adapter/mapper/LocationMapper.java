package com.cityexplorer.backend.infrastructure.adapter.mapper;

import com.cityexplorer.backend.infrastructure.adapter.provider.json.GeocodeJson;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class LocationMapper {

    /**
     * Maps the best geocoding match to a location row. Only the first result is kept.
     */
    public List<Map<String, Object>> mapToLocations(List<GeocodeJson.ResultJson> results) {
        if (results.isEmpty()) {
            return List.of();
        }
        GeocodeJson.ResultJson best = results.get(0);

        Map<String, Object> location = new LinkedHashMap<>();
        location.put("formatted_query", best.formattedAddress());
        location.put("latitude", best.geometry().location().lat());
        location.put("longitude", best.geometry().location().lng());
        return List.of(location);
    }
}
