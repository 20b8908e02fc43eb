package com.meteocache.weather;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Current conditions as returned by a {@link WeatherProvider}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeatherSummary {
    private String city;
    private String conditions;
    private Double temperatureCelsius;
    private Double feelsLikeCelsius;
    private Integer humidityPercent;
    private Double windSpeedMetersPerSecond;
    private Instant observedAt;
}
