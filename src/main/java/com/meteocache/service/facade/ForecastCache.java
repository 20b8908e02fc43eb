package com.meteocache.service.facade;

import com.meteocache.model.dto.CleanupResult;

import java.time.Instant;

/**
 * Cache of generated forecasts keyed by city.
 *
 * Implementations decide where payloads live; callers see a forecast as valid until
 * its TTL has elapsed since {@code forecastAt}. Only complete forecasts (text and audio)
 * are served: a forecast stored without audio is kept but never returned by {@link #lookup}.
 */
public interface ForecastCache {

    /**
     * Latest valid forecast for a city, or {@link CachedForecast#miss()}.
     */
    CachedForecast lookup(String city);

    /**
     * Store a forecast. {@code audio} may be null, in which case lookups miss until a
     * complete forecast is stored.
     */
    void store(String city, String text, AudioHandle audio, Instant forecastAt);

    ForecastCacheStats stats();

    /**
     * Remove expired forecasts.
     */
    CleanupResult cleanup();
}
