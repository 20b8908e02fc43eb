package com.meteocache.service.facade;

import com.meteocache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

class FileSystemForecastCacheContractTest extends ForecastCacheContract {

    @TempDir
    Path outputDir;

    private MutableClock clock;
    private FileSystemForecastCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        cache = new FileSystemForecastCache(outputDir, Duration.ofMinutes(30), Duration.ofSeconds(60), clock);
    }

    @Override
    protected ForecastCache cache() {
        return cache;
    }

    @Override
    protected MutableClock clock() {
        return clock;
    }
}
