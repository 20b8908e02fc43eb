package com.meteocache.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Byte sizes of a stored forecast's payloads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastSizes {
    private long text;
    private long audio;
    private long total;

    public static ForecastSizes of(Integer textBytes, Integer audioBytes) {
        long text = textBytes != null ? textBytes : 0;
        long audio = audioBytes != null ? audioBytes : 0;
        return new ForecastSizes(text, audio, text + audio);
    }
}
