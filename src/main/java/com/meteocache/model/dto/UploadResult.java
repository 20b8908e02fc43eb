package com.meteocache.model.dto;

import com.meteocache.codec.TextEncoding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a successful upload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResult {
    private UUID id;
    private Instant createdAt;
    private Instant expiresAt;
    private TextEncoding encoding;
    private String language;
    private String locale;
    private ForecastSizes sizes;
}
