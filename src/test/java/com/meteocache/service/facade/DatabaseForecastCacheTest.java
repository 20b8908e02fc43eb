package com.meteocache.service.facade;

import com.meteocache.model.dto.CleanupResult;
import com.meteocache.model.dto.CurrentForecast;
import com.meteocache.model.dto.ForecastUpload;
import com.meteocache.model.dto.StorageStatistics;
import com.meteocache.service.ForecastStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DatabaseForecastCacheTest {

    private static final Instant FORECAST_AT = Instant.parse("2025-12-26T15:00:00Z");

    @Mock
    private ForecastStore forecastStore;

    private DatabaseForecastCache cache;

    @BeforeEach
    void setUp() {
        cache = new DatabaseForecastCache(forecastStore, 30);
    }

    @Test
    void testLookupHitWrapsAudioBytes() throws IOException {
        // given
        when(forecastStore.getCurrent("Tokyo", null)).thenReturn(CurrentForecast.builder()
                .found(true)
                .text("Sunny")
                .audio(new byte[]{1, 2, 3})
                .ageSeconds(42L)
                .build());

        // when
        CachedForecast result = cache.lookup("Tokyo");

        // then
        assertTrue(result.isCached());
        assertEquals("Sunny", result.getText());
        assertEquals(42L, result.getAgeSeconds());
        assertArrayEquals(new byte[]{1, 2, 3}, result.getAudio().readAllBytes());
        assertTrue(result.getAudio().path().isEmpty());
    }

    @Test
    void testLookupMiss() {
        // given
        when(forecastStore.getCurrent("Atlantis", null)).thenReturn(CurrentForecast.notFound());

        // when
        CachedForecast result = cache.lookup("Atlantis");

        // then
        assertFalse(result.isCached());
        assertNull(result.getAudio());
    }

    @Test
    void testLookupWithoutAudioIsAMiss() {
        // given
        when(forecastStore.getCurrent("Tokyo", null)).thenReturn(CurrentForecast.builder()
                .found(true)
                .text("Sunny")
                .audio(new byte[0])
                .ageSeconds(5L)
                .build());

        // when
        CachedForecast result = cache.lookup("Tokyo");

        // then
        assertFalse(result.isCached());
        assertNull(result.getText());
        assertNull(result.getAudio());
    }

    @Test
    void testStoreUsesStoreDefaults() {
        // when
        cache.store("Tokyo", "Sunny", AudioHandle.ofBytes(new byte[]{9}), FORECAST_AT);

        // then
        ArgumentCaptor<ForecastUpload> captor = ArgumentCaptor.forClass(ForecastUpload.class);
        verify(forecastStore).upload(captor.capture());
        ForecastUpload upload = captor.getValue();
        assertEquals("Tokyo", upload.getCity());
        assertEquals(FORECAST_AT, upload.getForecastAt());
        assertArrayEquals(new byte[]{9}, upload.getAudio());
        assertNull(upload.getTtlMinutes());
        assertNull(upload.getEncoding());
    }

    @Test
    void testUnreadableAudioIsRejected() {
        // given
        AudioHandle broken = new AudioHandle() {
            @Override
            public InputStream open() throws IOException {
                throw new IOException("gone");
            }

            @Override
            public byte[] readAllBytes() throws IOException {
                throw new IOException("gone");
            }

            @Override
            public long size() {
                return 0;
            }

            @Override
            public Optional<Path> path() {
                return Optional.empty();
            }
        };

        // when / then
        assertThrows(IllegalArgumentException.class, () -> cache.store("Tokyo", "Sunny", broken, FORECAST_AT));
        verify(forecastStore, never()).upload(any());
    }

    @Test
    void testStatsFromStorageStatistics() {
        // given
        when(forecastStore.stats()).thenReturn(StorageStatistics.builder()
                .totalForecasts(3)
                .totalTextBytes(120)
                .totalAudioBytes(4000)
                .cityBreakdown(List.of(
                        StorageStatistics.CityStatistics.builder().city("tokyo").forecastCount(2).build(),
                        StorageStatistics.CityStatistics.builder().city("paris").forecastCount(1).build()))
                .build());
        when(forecastStore.countCities()).thenReturn(5L);

        // when
        ForecastCacheStats stats = cache.stats();

        // then
        assertEquals("database", stats.getBackend());
        assertEquals(1800, stats.getTtlSeconds());
        assertEquals(5, stats.getTotalCities());
        assertEquals(2, stats.getCitiesWithValidCache());
        assertEquals(List.of("paris", "tokyo"), stats.getCachedCities());
        assertEquals(3, stats.getTotalEntries());
    }

    @Test
    void testCleanupDelegates() {
        // given
        when(forecastStore.cleanupExpired()).thenReturn(new CleanupResult(4, 10));

        // when
        CleanupResult result = cache.cleanup();

        // then
        assertEquals(4, result.getDeletedCount());
        assertEquals(10, result.getRemainingCount());
    }
}
