package com.meteocache.repository;

import java.time.Instant;

public interface CityStatisticsView {
    String getCity();

    Long getForecastCount();

    Long getTotalTextBytes();

    Long getTotalAudioBytes();

    Instant getLatestForecast();
}
