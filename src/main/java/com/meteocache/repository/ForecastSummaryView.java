package com.meteocache.repository;

import java.time.Instant;
import java.util.UUID;

/**
 * Projection of a forecast row without its text and audio payloads.
 */
public interface ForecastSummaryView {
    UUID getId();

    String getCity();

    Instant getForecastAt();

    Instant getExpiresAt();

    Integer getTextSizeBytes();

    Integer getAudioSizeBytes();

    String getTextEncoding();

    String getTextLanguage();

    String getTextLocale();

    Instant getCreatedAt();
}
