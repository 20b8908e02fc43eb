package com.meteocache.service.facade;

import com.meteocache.exception.StoreUnavailableException;
import com.meteocache.model.dto.CleanupResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link ForecastCache} that keeps each forecast as a pair of files under
 * {@code <outputDir>/<city>/}:
 * <pre>
 * forecast_text_2025-12-26_150000.txt
 * forecast_audio_2025-12-26_150000.wav
 * </pre>
 * The file name carries {@code forecastAt} in UTC and is the only source of a forecast's age.
 * A hit needs the newest text file younger than the TTL plus an audio file whose timestamp
 * lies within the pairing window of it.
 */
@Slf4j
public class FileSystemForecastCache implements ForecastCache {

    static final String BACKEND = "filesystem";
    static final String TEXT_PREFIX = "forecast_text_";
    static final String AUDIO_PREFIX = "forecast_audio_";
    static final String TEXT_SUFFIX = ".txt";
    static final String AUDIO_SUFFIX = ".wav";

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss");

    private final Path outputDir;
    private final Duration ttl;
    private final Duration pairingWindow;
    private final Clock clock;

    public FileSystemForecastCache(Path outputDir, Duration ttl, Duration pairingWindow, Clock clock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        this.outputDir = outputDir;
        this.ttl = ttl;
        this.pairingWindow = pairingWindow;
        this.clock = clock;
    }

    @Override
    public CachedForecast lookup(String city) {
        Path cityDir = cityDirectory(city);
        if (!Files.isDirectory(cityDir)) {
            log.debug("Cache MISS: no directory for city={}", city);
            return CachedForecast.miss();
        }

        Instant now = clock.instant();
        try {
            Optional<ForecastFile> text = newestValid(listForecastFiles(cityDir, TEXT_PREFIX, TEXT_SUFFIX), now);
            if (text.isEmpty()) {
                log.debug("Cache MISS: no valid text file for city={}", city);
                return CachedForecast.miss();
            }

            Optional<ForecastFile> audio = pairedAudio(cityDir, text.get(), now);
            if (audio.isEmpty()) {
                log.debug("Cache MISS: text {} has no paired audio", text.get().getPath().getFileName());
                return CachedForecast.miss();
            }

            long ageSeconds = Math.max(0, Duration.between(text.get().getTimestamp(), now).getSeconds());
            log.debug("Cache HIT: city={}, file={}, age={}s", city, text.get().getPath().getFileName(), ageSeconds);

            return CachedForecast.builder()
                    .cached(true)
                    .text(Files.readString(text.get().getPath(), StandardCharsets.UTF_8))
                    .audio(AudioHandle.ofFile(audio.get().getPath()))
                    .ageSeconds(ageSeconds)
                    .build();

        } catch (IOException e) {
            log.error("Failed to read cached forecast for city={}", city, e);
            throw new StoreUnavailableException("Forecast files for '" + city + "' could not be read", e);
        }
    }

    @Override
    public void store(String city, String text, AudioHandle audio, Instant forecastAt) {
        if (text == null) {
            throw new IllegalArgumentException("Forecast text must not be null");
        }
        if (forecastAt == null) {
            throw new IllegalArgumentException("forecastAt must not be null");
        }

        Path cityDir = cityDirectory(city);
        String stamp = FILE_TIMESTAMP.format(LocalDateTime.ofInstant(forecastAt, ZoneOffset.UTC));
        Path textFile = cityDir.resolve(TEXT_PREFIX + stamp + TEXT_SUFFIX);

        try {
            Files.createDirectories(cityDir);
            Files.writeString(textFile, text, StandardCharsets.UTF_8);

            if (audio != null) {
                Path audioFile = cityDir.resolve(AUDIO_PREFIX + stamp + AUDIO_SUFFIX);
                try (InputStream in = audio.open()) {
                    Files.copy(in, audioFile, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        } catch (IOException e) {
            log.error("Failed to write forecast files to {}", cityDir, e);
            throw new StoreUnavailableException("Forecast for '" + city + "' could not be written", e);
        }

        log.info("Stored forecast files: city={}, timestamp={}, audio={}", city, stamp, audio != null);
    }

    @Override
    public ForecastCacheStats stats() {
        Instant now = clock.instant();
        List<String> cachedCities = new ArrayList<>();
        long totalEntries = 0;
        long textBytes = 0;
        long audioBytes = 0;

        List<Path> cityDirs = listCityDirectories();
        try {
            for (Path cityDir : cityDirs) {
                List<ForecastFile> validTexts = listForecastFiles(cityDir, TEXT_PREFIX, TEXT_SUFFIX).stream()
                        .filter(file -> isValid(file, now))
                        .collect(Collectors.toList());
                List<ForecastFile> validAudio = listForecastFiles(cityDir, AUDIO_PREFIX, AUDIO_SUFFIX).stream()
                        .filter(file -> isValid(file, now))
                        .collect(Collectors.toList());

                totalEntries += validTexts.size();
                for (ForecastFile file : validTexts) {
                    textBytes += Files.size(file.getPath());
                }
                for (ForecastFile file : validAudio) {
                    audioBytes += Files.size(file.getPath());
                }

                String city = cityDir.getFileName().toString();
                if (lookup(city).isCached()) {
                    cachedCities.add(city);
                }
            }
        } catch (IOException e) {
            log.error("Failed to scan forecast files under {}", outputDir, e);
            throw new StoreUnavailableException("Forecast files could not be scanned", e);
        }

        cachedCities.sort(Comparator.naturalOrder());
        return ForecastCacheStats.builder()
                .backend(BACKEND)
                .ttlSeconds(ttl.getSeconds())
                .totalCities(cityDirs.size())
                .citiesWithValidCache(cachedCities.size())
                .cachedCities(cachedCities)
                .totalEntries(totalEntries)
                .totalTextBytes(textBytes)
                .totalAudioBytes(audioBytes)
                .build();
    }

    /**
     * Delete forecast files whose age has reached the TTL and remove city directories left empty.
     * Files whose name carries no timestamp are left alone and counted as remaining.
     */
    @Override
    public CleanupResult cleanup() {
        Instant now = clock.instant();
        long deleted = 0;
        long remaining = 0;

        for (Path cityDir : listCityDirectories()) {
            try {
                List<ForecastFile> files = new ArrayList<>();
                files.addAll(listForecastFiles(cityDir, TEXT_PREFIX, TEXT_SUFFIX));
                files.addAll(listForecastFiles(cityDir, AUDIO_PREFIX, AUDIO_SUFFIX));

                for (ForecastFile file : files) {
                    if (file.getTimestamp() != null && !isValid(file, now)) {
                        Files.deleteIfExists(file.getPath());
                        deleted++;
                    } else {
                        remaining++;
                    }
                }

                if (isEmptyDirectory(cityDir)) {
                    Files.delete(cityDir);
                    log.debug("Removed empty city directory {}", cityDir);
                }
            } catch (IOException e) {
                log.error("Failed to clean up forecast files under {}", cityDir, e);
                throw new StoreUnavailableException("Forecast files could not be cleaned up", e);
            }
        }

        log.info("Cleanup removed {} expired forecast files, {} remaining", deleted, remaining);
        return new CleanupResult(deleted, remaining);
    }

    // ===========================
    // Private Helper Methods
    // ===========================

    private Optional<ForecastFile> pairedAudio(Path cityDir, ForecastFile text, Instant now) throws IOException {
        return listForecastFiles(cityDir, AUDIO_PREFIX, AUDIO_SUFFIX).stream()
                .filter(audio -> isValid(audio, now))
                .filter(audio -> Duration.between(audio.getTimestamp(), text.getTimestamp()).abs()
                        .compareTo(pairingWindow) < 0)
                .min(Comparator.comparing((ForecastFile audio) ->
                        Duration.between(audio.getTimestamp(), text.getTimestamp()).abs()));
    }

    private Optional<ForecastFile> newestValid(List<ForecastFile> files, Instant now) {
        return files.stream()
                .filter(file -> isValid(file, now))
                .max(Comparator.comparing(ForecastFile::getTimestamp));
    }

    private boolean isValid(ForecastFile file, Instant now) {
        return file.getTimestamp() != null
                && Duration.between(file.getTimestamp(), now).compareTo(ttl) < 0;
    }

    private List<ForecastFile> listForecastFiles(Path cityDir, String prefix, String suffix) throws IOException {
        try (Stream<Path> files = Files.list(cityDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(suffix);
                    })
                    .map(path -> new ForecastFile(path, parseTimestamp(path, prefix, suffix)))
                    .collect(Collectors.toList());
        }
    }

    private List<Path> listCityDirectories() {
        if (!Files.isDirectory(outputDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(outputDir)) {
            return entries.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to list {}", outputDir, e);
            throw new StoreUnavailableException("Forecast output directory could not be listed", e);
        }
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    static Instant parseTimestamp(Path file, String prefix, String suffix) {
        String name = file.getFileName().toString();
        String stamp = name.substring(prefix.length(), name.length() - suffix.length());
        try {
            return LocalDateTime.parse(stamp, FILE_TIMESTAMP).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring forecast file without a timestamp: {}", name);
            return null;
        }
    }

    private Path cityDirectory(String city) {
        if (city == null || city.isBlank()) {
            throw new IllegalArgumentException("City must not be empty");
        }
        String normalized = city.trim().toLowerCase(Locale.ROOT);
        if (normalized.contains("/") || normalized.contains("\\") || normalized.contains("..")) {
            throw new IllegalArgumentException("Invalid city name: " + city);
        }
        return outputDir.resolve(normalized);
    }

    private static final class ForecastFile {
        private final Path path;
        private final Instant timestamp;

        private ForecastFile(Path path, Instant timestamp) {
            this.path = path;
            this.timestamp = timestamp;
        }

        Path getPath() {
            return path;
        }

        Instant getTimestamp() {
            return timestamp;
        }
    }
}
