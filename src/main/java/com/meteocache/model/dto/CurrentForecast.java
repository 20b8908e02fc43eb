package com.meteocache.model.dto;

import com.meteocache.codec.TextEncoding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * The current (latest valid) forecast for a city, or {@code found = false} on a miss.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentForecast {

    private boolean found;

    private UUID id;

    private String city;

    private String text;

    /**
     * WAV audio; rendered as base64 in JSON.
     */
    private byte[] audio;

    private Instant forecastAt;

    private Instant expiresAt;

    /**
     * Whole seconds since {@code forecastAt}, never negative.
     */
    private Long ageSeconds;

    private TextEncoding encoding;

    private String language;

    private String locale;

    private ForecastSizes sizes;

    private Map<String, Object> metadata;

    public static CurrentForecast notFound() {
        return CurrentForecast.builder().found(false).build();
    }
}
