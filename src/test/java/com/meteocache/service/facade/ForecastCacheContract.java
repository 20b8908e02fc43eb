package com.meteocache.service.facade;

import com.meteocache.model.dto.CleanupResult;
import com.meteocache.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link ForecastCache} backend shares. Backends run it with a 30 minute TTL
 * and a clock starting at {@link #T0}.
 */
abstract class ForecastCacheContract {

    static final Instant T0 = Instant.parse("2025-12-26T15:00:00Z");
    static final byte[] WAV = {'R', 'I', 'F', 'F', 1, 2, 3, 4};

    protected abstract ForecastCache cache();

    protected abstract MutableClock clock();

    @Test
    void testCompleteForecastIsServed() throws Exception {
        cache().store("Tokyo", "Sunny, 22°C", AudioHandle.ofBytes(WAV), T0);
        clock().advance(Duration.ofMinutes(10));

        CachedForecast hit = cache().lookup("TOKYO");

        assertTrue(hit.isCached());
        assertEquals("Sunny, 22°C", hit.getText());
        assertEquals(600L, hit.getAgeSeconds());
        assertArrayEquals(WAV, hit.getAudio().readAllBytes());
    }

    @Test
    void testForecastWithoutAudioIsNotServed() {
        cache().store("Tokyo", "Sunny", null, T0);

        CachedForecast result = cache().lookup("tokyo");

        assertFalse(result.isCached());
        assertNull(result.getText());
        assertNull(result.getAudio());
    }

    @Test
    void testUnknownCityMisses() {
        cache().store("Tokyo", "Sunny", AudioHandle.ofBytes(WAV), T0);

        assertFalse(cache().lookup("atlantis").isCached());
    }

    @Test
    void testForecastExpiresAfterTtl() {
        cache().store("Paris", "Cloudy", AudioHandle.ofBytes(WAV), T0);

        clock().advance(Duration.ofMinutes(29));
        assertTrue(cache().lookup("paris").isCached());

        clock().advance(Duration.ofMinutes(1));
        assertFalse(cache().lookup("paris").isCached());
    }

    @Test
    void testCleanupRemovesExpiredForecastsOnce() {
        cache().store("Oslo", "Snow", AudioHandle.ofBytes(WAV), T0.minus(Duration.ofHours(1)));
        cache().store("Rome", "Warm", AudioHandle.ofBytes(WAV), T0);

        CleanupResult first = cache().cleanup();
        CleanupResult second = cache().cleanup();

        assertTrue(first.getDeletedCount() > 0);
        assertEquals(0, second.getDeletedCount());
        assertEquals(first.getRemainingCount(), second.getRemainingCount());
        assertTrue(cache().lookup("rome").isCached());
    }

    @Test
    void testStatsListCachedCities() {
        cache().store("Rome", "Warm", AudioHandle.ofBytes(WAV), T0);

        ForecastCacheStats stats = cache().stats();

        assertEquals(1800, stats.getTtlSeconds());
        assertEquals(1, stats.getCitiesWithValidCache());
        assertTrue(stats.getCachedCities().contains("rome"));
    }
}
