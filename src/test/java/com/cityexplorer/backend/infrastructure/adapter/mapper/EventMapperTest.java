package com.cityexplorer.backend.infrastructure.adapter.mapper;

import com.cityexplorer.backend.infrastructure.adapter.provider.json.EventSearchJson;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventMapperTest {

    private final EventMapper eventMapper = new EventMapper();

    @Test
    void shouldMapEventToCanonicalFields() {
        // Given
        EventSearchJson.EventJson event = event("https://eventbrite/1", "Jazz Night", "2024-03-15T19:30:00");

        // When
        List<Map<String, Object>> rows = eventMapper.mapToEvents(List.of(event));

        // Then
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0))
                .containsEntry("link", "https://eventbrite/1")
                .containsEntry("name", "Jazz Night")
                .containsEntry("event_date", "Fri Mar 15 2024")
                .containsEntry("summary", "Summary of Jazz Night");
    }

    @Test
    void shouldSkipEventsThatCannotBeMapped() {
        // Given
        EventSearchJson.EventJson valid = event("https://eventbrite/1", "Valid", "2024-03-15T19:30:00");
        EventSearchJson.EventJson badDate = event("https://eventbrite/2", "Bad date", "not-a-date");
        EventSearchJson.EventJson noStart = new EventSearchJson.EventJson(
                "https://eventbrite/3", new EventSearchJson.TextJson("No start"), null, null);

        // When
        List<Map<String, Object>> rows = eventMapper.mapToEvents(List.of(valid, badDate, noStart));

        // Then
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)).containsEntry("name", "Valid");
    }

    private EventSearchJson.EventJson event(String url, String name, String start) {
        return new EventSearchJson.EventJson(url, new EventSearchJson.TextJson(name),
                new EventSearchJson.StartJson(start), "Summary of " + name);
    }
}
