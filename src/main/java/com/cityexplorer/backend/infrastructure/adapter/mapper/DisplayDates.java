package com.cityexplorer.backend.infrastructure.adapter.mapper;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Day formatting shared by the mappers, e.g. {@code Mon Jan 01 2024}.
 */
final class DisplayDates {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("EEE MMM dd yyyy", Locale.US);

    private DisplayDates() {
    }

    static String ofEpochSeconds(long epochSeconds) {
        return DAY.format(Instant.ofEpochSecond(epochSeconds).atOffset(ZoneOffset.UTC));
    }

    static String ofLocalDateTime(String isoLocalDateTime) {
        return DAY.format(LocalDateTime.parse(isoLocalDateTime, DateTimeFormatter.ISO_LOCAL_DATE_TIME));
    }
}
