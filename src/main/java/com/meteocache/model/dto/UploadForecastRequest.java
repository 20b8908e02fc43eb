package com.meteocache.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON body of the admin upload endpoint.
 * {@code audio} is base64 in JSON; {@code forecastAt} is an ISO-8601 timestamp.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadForecastRequest {
    private String city;
    private String text;
    private byte[] audio;
    private String forecastAt;
    private Integer ttlMinutes;
    private String encoding;
    private String language;
    private String locale;
}
