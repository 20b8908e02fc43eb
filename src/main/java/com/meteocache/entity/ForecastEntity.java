package com.meteocache.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for the forecasts table.
 * One row is one text + audio forecast for a city, valid until {@code expiresAt}.
 * Rows are written once and never updated; the cleanup sweep deletes them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "forecasts", indexes = {
        @Index(name = "idx_city_expires", columnList = "city, expires_at DESC"),
        @Index(name = "idx_expires_cleanup", columnList = "expires_at"),
        @Index(name = "idx_forecast_at", columnList = "forecast_at DESC"),
        @Index(name = "idx_language", columnList = "text_language")
})
public class ForecastEntity {

    public static final String AUDIO_FORMAT_WAV = "wav";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Always lower-case
    @Column(name = "city", nullable = false, length = 100)
    private String city;

    @Column(name = "forecast_at", nullable = false)
    private Instant forecastAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    // Payloads
    @Column(name = "forecast_text", nullable = false, columnDefinition = "bytea")
    private byte[] forecastText;

    @Column(name = "audio_file", columnDefinition = "bytea")
    private byte[] audioFile;

    @Column(name = "text_size_bytes", nullable = false)
    private Integer textSizeBytes;

    @Column(name = "audio_size_bytes")
    private Integer audioSizeBytes;

    // Internationalization
    @Column(name = "text_encoding", nullable = false, length = 20)
    private String textEncoding;

    @Column(name = "text_language", length = 10)
    private String textLanguage;

    @Column(name = "text_locale", length = 20)
    private String textLocale;

    @Column(name = "audio_format", length = 10)
    private String audioFormat;

    @Column(name = "audio_language", length = 10)
    private String audioLanguage;

    // ttl_minutes, character_count, encoding_used
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (audioFormat == null) {
            audioFormat = AUDIO_FORMAT_WAV;
        }
        if (textSizeBytes == null && forecastText != null) {
            textSizeBytes = forecastText.length;
        }
        if (audioSizeBytes == null && audioFile != null) {
            audioSizeBytes = audioFile.length;
        }
    }
}
