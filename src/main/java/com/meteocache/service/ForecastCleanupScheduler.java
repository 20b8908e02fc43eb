package com.meteocache.service;

import com.meteocache.exception.StoreUnavailableException;
import com.meteocache.model.dto.CleanupResult;
import com.meteocache.service.facade.ForecastCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired forecasts from the configured cache backend.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "meteocache.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ForecastCleanupScheduler {

    private final ForecastCache forecastCache;

    public ForecastCleanupScheduler(ForecastCache forecastCache) {
        this.forecastCache = forecastCache;
    }

    @Scheduled(fixedDelayString = "${meteocache.cleanup.interval:PT15M}",
            initialDelayString = "${meteocache.cleanup.interval:PT15M}")
    public void removeExpired() {
        try {
            CleanupResult result = forecastCache.cleanup();
            log.debug("Scheduled cleanup: deleted={}, remaining={}",
                    result.getDeletedCount(), result.getRemainingCount());
        } catch (StoreUnavailableException e) {
            log.warn("Scheduled cleanup skipped, backing store unavailable: {}", e.getMessage());
        }
    }
}
