package com.cityexplorer.backend.domain.model;

/**
 * How rows of a resource type are keyed in storage.
 */
public enum KeyKind {

    /** Keyed by the free-text search string, stored in {@code search_query}. */
    SEARCH_QUERY("search_query"),

    /** Keyed by the id of a previously resolved location, stored in {@code location_id}. */
    LOCATION_ID("location_id");

    private final String column;

    KeyKind(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
