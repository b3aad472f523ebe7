package com.cityexplorer.backend.infrastructure.web.dto;

import com.cityexplorer.backend.domain.model.CachedRow;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/**
 * Flat JSON view of a cached row: id, key column, canonical fields, created_at.
 */
@JsonPropertyOrder({"id", "search_query", "location_id"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CachedRowResponse {

    private final CachedRow row;

    private CachedRowResponse(CachedRow row) {
        this.row = row;
    }

    public static CachedRowResponse fromRow(CachedRow row) {
        return new CachedRowResponse(row);
    }

    public static List<CachedRowResponse> fromRows(List<CachedRow> rows) {
        return rows.stream()
                .map(CachedRowResponse::fromRow)
                .toList();
    }

    @JsonProperty("id")
    public long getId() {
        return row.id();
    }

    @JsonProperty("search_query")
    public String getSearchQuery() {
        return row.searchKey();
    }

    @JsonProperty("location_id")
    public Long getLocationId() {
        return row.locationKey();
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return row.fields();
    }

    @JsonProperty("created_at")
    public long getCreatedAt() {
        return row.createdAt().toEpochMilli();
    }
}
