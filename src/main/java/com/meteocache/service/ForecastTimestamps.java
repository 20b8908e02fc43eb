package com.meteocache.service;

import com.meteocache.exception.InvalidTimestampException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parsing of caller-supplied forecast timestamps.
 */
public final class ForecastTimestamps {

    private ForecastTimestamps() {
    }

    /**
     * Parse an ISO-8601 timestamp such as {@code 2025-12-26T15:00:00Z} or
     * {@code 2025-12-26T15:00:00+01:00}. A timestamp without an offset is taken as UTC.
     *
     * @throws InvalidTimestampException if the value is missing or not ISO-8601
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidTimestampException("forecast_at must not be empty");
        }

        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidTimestampException("Invalid forecast_at timestamp format: " + value, e);
        }
    }
}
