package com.meteocache.weather;

import com.meteocache.cache.CachedFunction;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Decorates a {@link WeatherProvider} with an in-process TTL cache keyed by lower-cased city,
 * so repeated lookups for the same city within the TTL do not reach the upstream API.
 */
@Slf4j
public class CachedWeatherProvider implements WeatherProvider {

    private final CachedFunction<String, WeatherSummary> lookup;

    public CachedWeatherProvider(WeatherProvider delegate, Duration ttl, Clock clock) {
        this.lookup = new CachedFunction<>(
                "fetchCurrent",
                delegate::fetchCurrent,
                city -> city.trim().toLowerCase(Locale.ROOT),
                ttl,
                clock);
        log.info("Weather lookups cached for {}", ttl);
    }

    @Override
    public WeatherSummary fetchCurrent(String city) {
        if (city == null || city.isBlank()) {
            throw new IllegalArgumentException("City must not be empty");
        }
        return lookup.apply(city);
    }

    /**
     * Drop entries older than the TTL.
     *
     * @return number of entries evicted
     */
    public int evictExpired() {
        return lookup.sweep();
    }

    public void clear() {
        lookup.clear();
    }

    public int size() {
        return lookup.size();
    }
}
