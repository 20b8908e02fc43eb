package com.meteocache.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Storage statistics over currently valid (non-expired) forecasts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageStatistics {

    private long totalForecasts;

    private long totalTextBytes;

    private long totalAudioBytes;

    /**
     * Forecast count per text encoding.
     */
    private Map<String, Long> encodingsUsed;

    /**
     * Forecast count per language. Forecasts without a language are not counted.
     */
    private Map<String, Long> languagesUsed;

    /**
     * Breakdown by city, busiest first.
     */
    private List<CityStatistics> cityBreakdown;

    /**
     * Statistics for one city.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CityStatistics {
        private String city;
        private long forecastCount;
        private long totalTextBytes;
        private long totalAudioBytes;
        private Instant latestForecast;
    }
}
