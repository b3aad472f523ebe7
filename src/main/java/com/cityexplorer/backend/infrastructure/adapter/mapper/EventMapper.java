package com.cityexplorer.backend.infrastructure.adapter.mapper;

import com.cityexplorer.backend.infrastructure.adapter.provider.json.EventSearchJson;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EventMapper {

    private static final Logger logger = LoggerFactory.getLogger(EventMapper.class);

    /**
     * Maps Eventbrite events to event rows, skipping events that cannot be mapped
     */
    public List<Map<String, Object>> mapToEvents(List<EventSearchJson.EventJson> events) {
        return events.stream()
                .map(this::mapToEvent)
                .filter(Objects::nonNull)
                .toList();
    }

    private Map<String, Object> mapToEvent(EventSearchJson.EventJson event) {
        try {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("link", event.url());
            row.put("name", event.name() != null ? event.name().text() : null);
            row.put("event_date", DisplayDates.ofLocalDateTime(event.start().local()));
            row.put("summary", event.summary());
            return row;
        } catch (Exception e) {
            logger.warn("Failed to map event {} - {}", event.url(), e.getMessage());
            return null;
        }
    }
}
