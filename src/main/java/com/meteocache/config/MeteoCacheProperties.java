package com.meteocache.config;

import com.meteocache.codec.TextEncoding;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for MeteoCache.
 */
@Data
@Component
@ConfigurationProperties(prefix = "meteocache")
public class MeteoCacheProperties {

    private StoreConfig store = new StoreConfig();
    private CacheConfig cache = new CacheConfig();
    private CleanupConfig cleanup = new CleanupConfig();

    @Data
    public static class StoreConfig {
        private int defaultTtlMinutes = 30;
        /**
         * Encoding for uploads that do not name one. Unset means detect from the text.
         */
        private TextEncoding defaultEncoding;
        private Duration operationTimeout = Duration.ofSeconds(10);
        /**
         * Reported by the health probe. Falls back to the JDBC URL.
         */
        private String instanceId;
        private int maxHistoryLimit = 100;
    }

    @Data
    public static class CacheConfig {
        private Backend backend = Backend.DATABASE;
        private FileSystemConfig filesystem = new FileSystemConfig();
    }

    @Data
    public static class FileSystemConfig {
        private Path outputDir = Path.of("output");
        private Duration ttl = Duration.ofMinutes(30);
        /**
         * Maximum distance between the text and audio file timestamps of one forecast.
         */
        private Duration pairingWindow = Duration.ofSeconds(60);
    }

    @Data
    public static class CleanupConfig {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(15);
    }

    public enum Backend {
        DATABASE,
        FILESYSTEM
    }
}
