package com.meteocache.config;

import com.meteocache.service.ForecastStore;
import com.meteocache.service.facade.DatabaseForecastCache;
import com.meteocache.service.facade.FileSystemForecastCache;
import com.meteocache.service.facade.ForecastCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Forecast cache backend selection, driven by {@code meteocache.cache.backend}.
 */
@Slf4j
@Configuration
public class ForecastCacheConfiguration {

    private final MeteoCacheProperties properties;

    public ForecastCacheConfiguration(MeteoCacheProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ForecastCache forecastCache(ForecastStore forecastStore, Clock clock) {
        MeteoCacheProperties.Backend backend = properties.getCache().getBackend();
        if (backend == null) {
            backend = MeteoCacheProperties.Backend.DATABASE;
        }

        switch (backend) {
            case FILESYSTEM:
                MeteoCacheProperties.FileSystemConfig filesystem = properties.getCache().getFilesystem();
                log.info("Forecast cache backend: filesystem (dir={}, ttl={})",
                        filesystem.getOutputDir(), filesystem.getTtl());
                return new FileSystemForecastCache(
                        filesystem.getOutputDir(), filesystem.getTtl(), filesystem.getPairingWindow(), clock);
            case DATABASE:
            default:
                int ttlMinutes = properties.getStore().getDefaultTtlMinutes();
                log.info("Forecast cache backend: database (ttl={} minutes)", ttlMinutes);
                return new DatabaseForecastCache(forecastStore, ttlMinutes);
        }
    }
}
