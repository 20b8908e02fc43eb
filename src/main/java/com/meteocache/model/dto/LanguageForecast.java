package com.meteocache.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A valid forecast returned by a language query, with its decoded text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LanguageForecast {
    private UUID id;
    private String city;
    private String text;
    private Instant forecastAt;
    private String locale;
}
