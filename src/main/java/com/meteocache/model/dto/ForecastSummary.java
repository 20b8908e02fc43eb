package com.meteocache.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Summary view of a stored forecast for history listings.
 * Contains no payloads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastSummary {
    private UUID id;
    private String city;
    private Instant forecastAt;
    private Instant expiresAt;

    /**
     * Computed when the listing was read, never stored.
     */
    private boolean expired;

    private ForecastSizes sizes;
    private String encoding;
    private String language;
    private String locale;
    private Instant createdAt;
}
