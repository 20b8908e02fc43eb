package com.meteocache.service.facade;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastCacheStats {

    /**
     * Backend name: {@code database} or {@code filesystem}.
     */
    private String backend;

    private long ttlSeconds;

    private long totalCities;

    private long citiesWithValidCache;

    /**
     * Cities holding a valid forecast, sorted by name.
     */
    private List<String> cachedCities;

    private long totalEntries;

    private long totalTextBytes;

    private long totalAudioBytes;
}
