package com.cityexplorer.backend.infrastructure.adapter.mapper;

import com.cityexplorer.backend.infrastructure.adapter.provider.json.BusinessSearchJson;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class BusinessMapper {

    public List<Map<String, Object>> mapToBusinesses(List<BusinessSearchJson.BusinessJson> businesses) {
        return businesses.stream()
                .map(this::mapToBusiness)
                .toList();
    }

    private Map<String, Object> mapToBusiness(BusinessSearchJson.BusinessJson business) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", business.name());
        row.put("image_url", business.imageUrl());
        row.put("price", business.price());
        row.put("rating", business.rating());
        row.put("url", business.url());
        return row;
    }
}
