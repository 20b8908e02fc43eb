package com.meteocache.service.facade;

import com.meteocache.model.dto.CleanupResult;
import com.meteocache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemForecastCacheTest {

    private static final Instant T0 = Instant.parse("2025-12-26T15:00:00Z");
    private static final byte[] WAV = {'R', 'I', 'F', 'F', 0, 0, 0, 0};

    @TempDir
    Path outputDir;

    private MutableClock clock;
    private FileSystemForecastCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        cache = new FileSystemForecastCache(outputDir, Duration.ofMinutes(30), Duration.ofSeconds(60), clock);
    }

    @Test
    void testStoreWritesTimestampedFiles() {
        cache.store("Tokyo", "Sunny", AudioHandle.ofBytes(WAV), T0);

        assertTrue(Files.exists(outputDir.resolve("tokyo/forecast_text_2025-12-26_150000.txt")));
        assertTrue(Files.exists(outputDir.resolve("tokyo/forecast_audio_2025-12-26_150000.wav")));
    }

    @Test
    void testLookupReturnsFreshPair() throws IOException {
        cache.store("Tokyo", "晴れ", AudioHandle.ofBytes(WAV), T0);
        clock.advance(Duration.ofMinutes(10));

        CachedForecast hit = cache.lookup("TOKYO");

        assertTrue(hit.isCached());
        assertEquals("晴れ", hit.getText());
        assertEquals(600L, hit.getAgeSeconds());
        assertTrue(hit.getAudio().path().isPresent());
        assertArrayEquals(WAV, hit.getAudio().readAllBytes());
        assertEquals(WAV.length, hit.getAudio().size());
    }

    @Test
    void testLookupMissesAfterTtl() {
        cache.store("Tokyo", "Sunny", AudioHandle.ofBytes(WAV), T0);
        clock.advance(Duration.ofMinutes(30));

        assertFalse(cache.lookup("tokyo").isCached());
    }

    @Test
    void testTextWithoutAudioIsAMiss() {
        cache.store("Tokyo", "Sunny", null, T0);

        assertFalse(cache.lookup("tokyo").isCached());
    }

    @Test
    void testAudioOutsidePairingWindowIsIgnored() throws IOException {
        Path cityDir = Files.createDirectories(outputDir.resolve("lima"));
        Files.writeString(cityDir.resolve("forecast_text_2025-12-26_150000.txt"), "Fog", StandardCharsets.UTF_8);
        Files.write(cityDir.resolve("forecast_audio_2025-12-26_150200.wav"), WAV);

        assertFalse(cache.lookup("lima").isCached());

        Files.write(cityDir.resolve("forecast_audio_2025-12-26_150030.wav"), WAV);
        assertTrue(cache.lookup("lima").isCached());
    }

    @Test
    void testNewestTextWins() {
        cache.store("Paris", "Cloudy", AudioHandle.ofBytes(WAV), T0);
        cache.store("Paris", "Rain", AudioHandle.ofBytes(WAV), T0.plus(Duration.ofMinutes(5)));
        clock.advance(Duration.ofMinutes(6));

        assertEquals("Rain", cache.lookup("paris").getText());
    }

    @Test
    void testUnknownCityIsAMiss() {
        assertFalse(cache.lookup("atlantis").isCached());
    }

    @Test
    void testPathTraversalRejected() {
        assertThrows(IllegalArgumentException.class, () -> cache.lookup("../etc"));
        assertThrows(IllegalArgumentException.class,
                () -> cache.store("a/b", "Sunny", null, T0));
    }

    @Test
    void testCleanupRemovesExpiredFilesAndEmptyDirectories() {
        cache.store("Oslo", "Snow", AudioHandle.ofBytes(WAV), T0.minus(Duration.ofHours(1)));
        cache.store("Rome", "Warm", AudioHandle.ofBytes(WAV), T0);

        CleanupResult first = cache.cleanup();
        CleanupResult second = cache.cleanup();

        assertEquals(2, first.getDeletedCount());
        assertEquals(2, first.getRemainingCount());
        assertFalse(Files.exists(outputDir.resolve("oslo")));
        assertTrue(Files.exists(outputDir.resolve("rome")));
        assertEquals(0, second.getDeletedCount());
        assertEquals(2, second.getRemainingCount());
    }

    @Test
    void testStats() {
        cache.store("Oslo", "Snow", AudioHandle.ofBytes(WAV), T0.minus(Duration.ofHours(1)));
        cache.store("Rome", "Warm", AudioHandle.ofBytes(WAV), T0);
        cache.store("Bern", "Mild", AudioHandle.ofBytes(WAV), T0);

        ForecastCacheStats stats = cache.stats();

        assertEquals("filesystem", stats.getBackend());
        assertEquals(1800, stats.getTtlSeconds());
        assertEquals(3, stats.getTotalCities());
        assertEquals(2, stats.getCitiesWithValidCache());
        assertEquals(List.of("bern", "rome"), stats.getCachedCities());
        assertEquals(2, stats.getTotalEntries());
        assertEquals(8, stats.getTotalTextBytes());
        assertEquals(2L * WAV.length, stats.getTotalAudioBytes());
    }

    @Test
    void testStatsOnMissingOutputDirectory() {
        FileSystemForecastCache empty = new FileSystemForecastCache(
                outputDir.resolve("missing"), Duration.ofMinutes(30), Duration.ofSeconds(60), clock);

        ForecastCacheStats stats = empty.stats();

        assertEquals(0, stats.getTotalCities());
        assertEquals(0, empty.cleanup().getDeletedCount());
    }
}
