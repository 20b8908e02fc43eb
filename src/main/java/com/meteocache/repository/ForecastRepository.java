package com.meteocache.repository;

import com.meteocache.entity.ForecastEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for forecast records.
 * City arguments are expected lower-case; validity is always evaluated against a caller-supplied instant.
 */
@Repository
public interface ForecastRepository extends JpaRepository<ForecastEntity, UUID> {

    /**
     * Latest valid forecast for a city.
     */
    Optional<ForecastEntity> findFirstByCityAndExpiresAtAfterOrderByForecastAtDescCreatedAtDesc(
            String city, Instant now);

    /**
     * Latest valid forecast for a city in one language.
     */
    Optional<ForecastEntity> findFirstByCityAndTextLanguageAndExpiresAtAfterOrderByForecastAtDescCreatedAtDesc(
            String city, String textLanguage, Instant now);

    /**
     * History for a city, newest first, without payload columns.
     */
    List<ForecastSummaryView> findByCityOrderByForecastAtDesc(String city, Pageable pageable);

    /**
     * History across all cities, newest first, without payload columns.
     */
    List<ForecastSummaryView> findByOrderByForecastAtDesc(Pageable pageable);

    /**
     * Valid forecasts in a language.
     */
    List<ForecastEntity> findByTextLanguageAndExpiresAtAfterOrderByForecastAtDesc(
            String textLanguage, Instant now);

    /**
     * Valid forecasts in a language for one city.
     */
    List<ForecastEntity> findByTextLanguageAndCityAndExpiresAtAfterOrderByForecastAtDesc(
            String textLanguage, String city, Instant now);

    /**
     * Delete expired forecasts.
     */
    @Modifying
    @Query("DELETE FROM ForecastEntity f WHERE f.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);

    /**
     * Number of distinct cities with at least one record, expired or not.
     */
    @Query("SELECT COUNT(DISTINCT f.city) FROM ForecastEntity f")
    long countDistinctCities();

    /**
     * Count, text bytes and audio bytes over valid forecasts.
     */
    @Query("""
            SELECT COUNT(f) AS totalForecasts,
                   COALESCE(SUM(f.textSizeBytes), 0) AS totalTextBytes,
                   COALESCE(SUM(f.audioSizeBytes), 0) AS totalAudioBytes
            FROM ForecastEntity f
            WHERE f.expiresAt > :now
            """)
    StorageTotalsView sumValid(@Param("now") Instant now);

    /**
     * Valid forecasts per text encoding.
     */
    @Query("""
            SELECT f.textEncoding AS label, COUNT(f) AS occurrences
            FROM ForecastEntity f
            WHERE f.expiresAt > :now AND f.textEncoding IS NOT NULL
            GROUP BY f.textEncoding
            """)
    List<LabelCountView> countValidByEncoding(@Param("now") Instant now);

    /**
     * Valid forecasts per text language. Forecasts without a language are not counted.
     */
    @Query("""
            SELECT f.textLanguage AS label, COUNT(f) AS occurrences
            FROM ForecastEntity f
            WHERE f.expiresAt > :now AND f.textLanguage IS NOT NULL
            GROUP BY f.textLanguage
            """)
    List<LabelCountView> countValidByLanguage(@Param("now") Instant now);

    /**
     * Per-city breakdown of valid forecasts, busiest city first.
     */
    @Query("""
            SELECT f.city AS city,
                   COUNT(f) AS forecastCount,
                   COALESCE(SUM(f.textSizeBytes), 0) AS totalTextBytes,
                   COALESCE(SUM(f.audioSizeBytes), 0) AS totalAudioBytes,
                   MAX(f.forecastAt) AS latestForecast
            FROM ForecastEntity f
            WHERE f.expiresAt > :now
            GROUP BY f.city
            ORDER BY COUNT(f) DESC, f.city ASC
            """)
    List<CityStatisticsView> cityBreakdown(@Param("now") Instant now);
}
