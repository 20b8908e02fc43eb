package com.meteocache.model.dto;

import com.meteocache.codec.TextEncoding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A forecast to persist: text, audio and the instant it describes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastUpload {

    /**
     * City name, stored lower-case.
     */
    private String city;

    private String text;

    private byte[] audio;

    /**
     * Instant the forecast describes, not the write time.
     */
    private Instant forecastAt;

    /**
     * Time-to-live in minutes; the store default applies when null.
     */
    private Integer ttlMinutes;

    /**
     * Text encoding; detected from the text when null.
     */
    private TextEncoding encoding;

    /**
     * ISO 639-1 language code (en, es, ja, ...).
     */
    private String language;

    /**
     * Full locale (en-US, es-MX, ja-JP, ...).
     */
    private String locale;
}
