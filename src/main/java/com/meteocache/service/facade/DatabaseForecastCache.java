package com.meteocache.service.facade;

import com.meteocache.model.dto.CleanupResult;
import com.meteocache.model.dto.CurrentForecast;
import com.meteocache.model.dto.ForecastUpload;
import com.meteocache.model.dto.StorageStatistics;
import com.meteocache.service.ForecastStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link ForecastCache} over the relational {@link ForecastStore}, using the store's
 * default TTL and encoding.
 */
@Slf4j
public class DatabaseForecastCache implements ForecastCache {

    static final String BACKEND = "database";

    private final ForecastStore forecastStore;
    private final long ttlSeconds;

    public DatabaseForecastCache(ForecastStore forecastStore, int defaultTtlMinutes) {
        this.forecastStore = forecastStore;
        this.ttlSeconds = defaultTtlMinutes * 60L;
    }

    @Override
    public CachedForecast lookup(String city) {
        CurrentForecast current = forecastStore.getCurrent(city, null);
        if (!current.isFound()) {
            return CachedForecast.miss();
        }

        byte[] audio = current.getAudio();
        if (audio == null || audio.length == 0) {
            log.debug("Cache MISS: forecast {} for city={} has no audio", current.getId(), city);
            return CachedForecast.miss();
        }

        return CachedForecast.builder()
                .cached(true)
                .text(current.getText())
                .audio(AudioHandle.ofBytes(audio))
                .ageSeconds(current.getAgeSeconds())
                .build();
    }

    @Override
    public void store(String city, String text, AudioHandle audio, Instant forecastAt) {
        byte[] audioBytes = readAudio(audio);

        forecastStore.upload(ForecastUpload.builder()
                .city(city)
                .text(text)
                .audio(audioBytes)
                .forecastAt(forecastAt)
                .build());
    }

    @Override
    public ForecastCacheStats stats() {
        StorageStatistics statistics = forecastStore.stats();
        List<String> cachedCities = statistics.getCityBreakdown().stream()
                .map(StorageStatistics.CityStatistics::getCity)
                .sorted()
                .collect(Collectors.toList());

        return ForecastCacheStats.builder()
                .backend(BACKEND)
                .ttlSeconds(ttlSeconds)
                .totalCities(forecastStore.countCities())
                .citiesWithValidCache(cachedCities.size())
                .cachedCities(cachedCities)
                .totalEntries(statistics.getTotalForecasts())
                .totalTextBytes(statistics.getTotalTextBytes())
                .totalAudioBytes(statistics.getTotalAudioBytes())
                .build();
    }

    @Override
    public CleanupResult cleanup() {
        return forecastStore.cleanupExpired();
    }

    private static byte[] readAudio(AudioHandle audio) {
        if (audio == null) {
            return new byte[0];
        }
        try {
            return audio.readAllBytes();
        } catch (IOException e) {
            log.error("Failed to read audio payload from {}", audio, e);
            throw new IllegalArgumentException("Audio payload could not be read", e);
        }
    }
}
