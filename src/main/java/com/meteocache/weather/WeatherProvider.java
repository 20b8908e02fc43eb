package com.meteocache.weather;

/**
 * Source of current weather conditions for a city.
 * Implementations talk to an external weather API.
 */
public interface WeatherProvider {

    /**
     * Fetch current conditions for a city.
     *
     * @param city city name as given by the caller
     * @return current conditions, or {@code null} if the provider has no data for the city
     */
    WeatherSummary fetchCurrent(String city);
}
