package com.meteocache.service.facade;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a facade lookup. On a miss only {@code cached = false} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedForecast {

    private boolean cached;

    private String text;

    private AudioHandle audio;

    private Long ageSeconds;

    public static CachedForecast miss() {
        return CachedForecast.builder().cached(false).build();
    }
}
