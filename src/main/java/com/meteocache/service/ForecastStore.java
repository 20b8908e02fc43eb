package com.meteocache.service;

import com.meteocache.codec.EncodedText;
import com.meteocache.codec.TextCodec;
import com.meteocache.codec.TextEncoding;
import com.meteocache.config.MeteoCacheProperties;
import com.meteocache.entity.ForecastEntity;
import com.meteocache.exception.DecodingException;
import com.meteocache.exception.EncodingException;
import com.meteocache.exception.ForecastDataCorruptedException;
import com.meteocache.exception.InvalidTimestampException;
import com.meteocache.exception.StoreUnavailableException;
import com.meteocache.model.dto.CleanupResult;
import com.meteocache.model.dto.ConnectionStatus;
import com.meteocache.model.dto.CurrentForecast;
import com.meteocache.model.dto.ForecastSizes;
import com.meteocache.model.dto.ForecastSummary;
import com.meteocache.model.dto.ForecastUpload;
import com.meteocache.model.dto.LanguageForecast;
import com.meteocache.model.dto.StorageStatistics;
import com.meteocache.model.dto.UploadResult;
import com.meteocache.repository.CityStatisticsView;
import com.meteocache.repository.ForecastRepository;
import com.meteocache.repository.ForecastSummaryView;
import com.meteocache.repository.LabelCountView;
import com.meteocache.repository.StorageTotalsView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Persistence and querying of forecast records.
 *
 * Every operation runs as one transaction and accepts an optional deadline; failures of the
 * backing store, including an expired deadline, surface as {@link StoreUnavailableException}.
 * A cache miss is a normal result ({@link CurrentForecast#notFound()}), never an exception.
 */
@Slf4j
@Service
public class ForecastStore {

    static final String TABLE_NAME = "forecasts";
    static final int MAX_CITY_LENGTH = 100;

    private final ForecastRepository forecastRepository;
    private final TextCodec textCodec;
    private final PlatformTransactionManager transactionManager;
    private final DataSource dataSource;
    private final MeteoCacheProperties properties;
    private final Clock clock;

    public ForecastStore(ForecastRepository forecastRepository,
                         TextCodec textCodec,
                         PlatformTransactionManager transactionManager,
                         DataSource dataSource,
                         MeteoCacheProperties properties,
                         Clock clock) {
        this.forecastRepository = forecastRepository;
        this.textCodec = textCodec;
        this.transactionManager = transactionManager;
        this.dataSource = dataSource;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Persist a new forecast.
     */
    public UploadResult upload(ForecastUpload upload) {
        return upload(upload, defaultTimeout());
    }

    /**
     * Persist a new forecast within the given deadline.
     *
     * The text is encoded before the transaction starts, so an encoding failure never
     * leaves a partial record behind.
     *
     * @throws EncodingException if the text cannot be encoded
     * @throws InvalidTimestampException if {@code forecastAt} is missing or out of range
     * @throws StoreUnavailableException if the write fails; nothing is persisted
     */
    public UploadResult upload(ForecastUpload upload, Duration timeout) {
        String city = normalizeCity(upload.getCity());
        if (upload.getText() == null) {
            throw new IllegalArgumentException("Forecast text must not be null");
        }

        int ttlMinutes = upload.getTtlMinutes() != null
                ? upload.getTtlMinutes()
                : properties.getStore().getDefaultTtlMinutes();
        if (ttlMinutes <= 0) {
            throw new IllegalArgumentException("ttl_minutes must be positive: " + ttlMinutes);
        }

        Instant forecastAt = upload.getForecastAt();
        if (forecastAt == null) {
            throw new InvalidTimestampException("forecast_at must not be null");
        }
        Instant expiresAt;
        try {
            expiresAt = forecastAt.plus(Duration.ofMinutes(ttlMinutes));
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidTimestampException("forecast_at out of range: " + forecastAt, e);
        }

        TextEncoding encoding = resolveEncoding(upload);
        EncodedText encoded = textCodec.encode(upload.getText(), encoding);
        byte[] audio = upload.getAudio() != null ? upload.getAudio() : new byte[0];

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ttl_minutes", ttlMinutes);
        metadata.put("character_count", upload.getText().codePointCount(0, upload.getText().length()));
        metadata.put("encoding_used", encoded.getEncoding().getStoredName());

        ForecastEntity entity = ForecastEntity.builder()
                .city(city)
                .forecastAt(forecastAt)
                .expiresAt(expiresAt)
                .forecastText(encoded.getBytes())
                .audioFile(audio)
                .textSizeBytes(encoded.getByteLength())
                .audioSizeBytes(audio.length)
                .textEncoding(encoded.getEncoding().getStoredName())
                .textLanguage(blankToNull(upload.getLanguage()))
                .textLocale(blankToNull(upload.getLocale()))
                .audioFormat(ForecastEntity.AUDIO_FORMAT_WAV)
                .audioLanguage(blankToNull(upload.getLanguage()))
                .metadata(metadata)
                .createdAt(clock.instant())
                .build();

        ForecastEntity saved = inTransaction("upload", timeout, false,
                status -> forecastRepository.saveAndFlush(entity));

        log.info("Stored forecast: id={}, city={}, encoding={}, text={}B, audio={}B, expires_at={}",
                saved.getId(), city, encoded.getEncoding(), encoded.getByteLength(), audio.length, expiresAt);

        return UploadResult.builder()
                .id(saved.getId())
                .createdAt(saved.getCreatedAt())
                .expiresAt(saved.getExpiresAt())
                .encoding(encoded.getEncoding())
                .language(saved.getTextLanguage())
                .locale(saved.getTextLocale())
                .sizes(ForecastSizes.of(encoded.getByteLength(), audio.length))
                .build();
    }

    /**
     * Latest valid forecast for a city, optionally in one language.
     */
    public CurrentForecast getCurrent(String city, String language) {
        return getCurrent(city, language, defaultTimeout());
    }

    /**
     * Latest valid forecast for a city within the given deadline.
     *
     * Among records with {@code expiresAt > now} the latest {@code forecastAt} wins,
     * ties going to the latest {@code createdAt}.
     *
     * @throws ForecastDataCorruptedException if the stored text cannot be decoded
     */
    public CurrentForecast getCurrent(String city, String language, Duration timeout) {
        String normalizedCity = normalizeCity(city);
        String normalizedLanguage = blankToNull(language);
        Instant now = clock.instant();

        Optional<ForecastEntity> current = inTransaction("get_current", timeout, true, status ->
                normalizedLanguage == null
                        ? forecastRepository.findFirstByCityAndExpiresAtAfterOrderByForecastAtDescCreatedAtDesc(
                                normalizedCity, now)
                        : forecastRepository.findFirstByCityAndTextLanguageAndExpiresAtAfterOrderByForecastAtDescCreatedAtDesc(
                                normalizedCity, normalizedLanguage, now));

        if (current.isEmpty()) {
            log.debug("Cache MISS: city={}, language={}", normalizedCity, normalizedLanguage);
            return CurrentForecast.notFound();
        }

        ForecastEntity entity = current.get();
        TextEncoding encoding = storedEncoding(entity);
        String text = decodeText(entity, encoding);
        long ageSeconds = Math.max(0, Duration.between(entity.getForecastAt(), now).getSeconds());

        log.debug("Cache HIT: city={}, id={}, age={}s", normalizedCity, entity.getId(), ageSeconds);

        return CurrentForecast.builder()
                .found(true)
                .id(entity.getId())
                .city(entity.getCity())
                .text(text)
                .audio(entity.getAudioFile())
                .forecastAt(entity.getForecastAt())
                .expiresAt(entity.getExpiresAt())
                .ageSeconds(ageSeconds)
                .encoding(encoding)
                .language(entity.getTextLanguage())
                .locale(entity.getTextLocale())
                .sizes(ForecastSizes.of(entity.getTextSizeBytes(), entity.getAudioSizeBytes()))
                .metadata(entity.getMetadata())
                .build();
    }

    /**
     * Forecast history, newest first, expired records included and flagged.
     *
     * @param city  city to list, or {@code null} for all cities
     * @param limit maximum number of results, at least 1
     */
    public List<ForecastSummary> list(String city, int limit) {
        return list(city, limit, defaultTimeout());
    }

    public List<ForecastSummary> list(String city, int limit, Duration timeout) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1: " + limit);
        }
        String normalizedCity = city == null || city.isBlank() ? null : normalizeCity(city);
        Instant now = clock.instant();
        PageRequest page = PageRequest.of(0, limit);

        List<ForecastSummaryView> rows = inTransaction("list", timeout, true, status ->
                normalizedCity == null
                        ? forecastRepository.findByOrderByForecastAtDesc(page)
                        : forecastRepository.findByCityOrderByForecastAtDesc(normalizedCity, page));

        return rows.stream()
                .map(row -> toSummary(row, now))
                .collect(Collectors.toList());
    }

    /**
     * Valid forecasts in a language, newest first, with decoded text.
     *
     * @param language ISO 639-1 code
     * @param city     optional city filter
     */
    public List<LanguageForecast> listByLanguage(String language, String city) {
        return listByLanguage(language, city, defaultTimeout());
    }

    public List<LanguageForecast> listByLanguage(String language, String city, Duration timeout) {
        String normalizedLanguage = blankToNull(language);
        if (normalizedLanguage == null) {
            throw new IllegalArgumentException("language must not be empty");
        }
        String normalizedCity = city == null || city.isBlank() ? null : normalizeCity(city);
        Instant now = clock.instant();

        List<ForecastEntity> rows = inTransaction("list_by_language", timeout, true, status ->
                normalizedCity == null
                        ? forecastRepository.findByTextLanguageAndExpiresAtAfterOrderByForecastAtDesc(
                                normalizedLanguage, now)
                        : forecastRepository.findByTextLanguageAndCityAndExpiresAtAfterOrderByForecastAtDesc(
                                normalizedLanguage, normalizedCity, now));

        return rows.stream()
                .map(entity -> LanguageForecast.builder()
                        .id(entity.getId())
                        .city(entity.getCity())
                        .text(decodeText(entity, storedEncoding(entity)))
                        .forecastAt(entity.getForecastAt())
                        .locale(entity.getTextLocale())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Delete every forecast whose {@code expiresAt} has passed.
     * Calling it again immediately deletes nothing and reports the same remaining count.
     */
    public CleanupResult cleanupExpired() {
        return cleanupExpired(defaultTimeout());
    }

    public CleanupResult cleanupExpired(Duration timeout) {
        Instant now = clock.instant();

        CleanupResult result = inTransaction("cleanup_expired", timeout, false, status -> {
            int deleted = forecastRepository.deleteExpired(now);
            long remaining = forecastRepository.count();
            return new CleanupResult(deleted, remaining);
        });

        log.info("Cleanup removed {} expired forecasts, {} remaining",
                result.getDeletedCount(), result.getRemainingCount());
        return result;
    }

    /**
     * Storage statistics over currently valid forecasts.
     */
    public StorageStatistics stats() {
        return stats(defaultTimeout());
    }

    public StorageStatistics stats(Duration timeout) {
        Instant now = clock.instant();

        return inTransaction("stats", timeout, true, status -> {
            StorageTotalsView totals = forecastRepository.sumValid(now);
            List<StorageStatistics.CityStatistics> cities = forecastRepository.cityBreakdown(now).stream()
                    .map(ForecastStore::toCityStatistics)
                    .collect(Collectors.toList());

            return StorageStatistics.builder()
                    .totalForecasts(nullToZero(totals.getTotalForecasts()))
                    .totalTextBytes(nullToZero(totals.getTotalTextBytes()))
                    .totalAudioBytes(nullToZero(totals.getTotalAudioBytes()))
                    .encodingsUsed(toHistogram(forecastRepository.countValidByEncoding(now)))
                    .languagesUsed(toHistogram(forecastRepository.countValidByLanguage(now)))
                    .cityBreakdown(cities)
                    .build();
        });
    }

    /**
     * Number of distinct cities with stored forecasts, expired ones included.
     */
    public long countCities() {
        return countCities(defaultTimeout());
    }

    public long countCities(Duration timeout) {
        return inTransaction("count_cities", timeout, true, status -> forecastRepository.countDistinctCities());
    }

    /**
     * Probe the backing store. Never throws.
     *
     * Distinguishes an unreachable store ({@code connected = false}) from a reachable one
     * without the forecasts table ({@code schemaReady = false}).
     */
    public ConnectionStatus testConnection() {
        return testConnection(defaultTimeout());
    }

    public ConnectionStatus testConnection(Duration timeout) {
        String configuredInstance = properties.getStore().getInstanceId();

        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(toTimeoutSeconds(timeout))) {
                log.warn("Backing store connection failed validation within {}", timeout);
                return unreachable(configuredInstance);
            }

            DatabaseMetaData metaData = connection.getMetaData();
            boolean schemaReady = tableExists(metaData);
            if (!schemaReady) {
                log.warn("Backing store reachable but table '{}' is missing", TABLE_NAME);
            }

            return ConnectionStatus.builder()
                    .connected(true)
                    .instanceId(configuredInstance != null ? configuredInstance : stripQuery(metaData.getURL()))
                    .databaseName(connection.getCatalog())
                    .version(metaData.getDatabaseProductName() + " " + metaData.getDatabaseProductVersion())
                    .schemaReady(schemaReady)
                    .build();

        } catch (SQLException | DataAccessException e) {
            log.error("Backing store unreachable", e);
            return unreachable(configuredInstance);
        }
    }

    // ===========================
    // Private Helper Methods
    // ===========================

    private <T> T inTransaction(String operation, Duration timeout, boolean readOnly, TransactionCallback<T> action) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setName("forecast-store." + operation);
        template.setReadOnly(readOnly);
        template.setTimeout(timeout != null ? toTimeoutSeconds(timeout) : TransactionDefinition.TIMEOUT_DEFAULT);

        try {
            return template.execute(action);
        } catch (DataAccessException | TransactionException e) {
            log.error("Forecast store operation '{}' failed", operation, e);
            throw new StoreUnavailableException("Forecast store operation '" + operation + "' failed", e);
        }
    }

    private TextEncoding resolveEncoding(ForecastUpload upload) {
        if (upload.getEncoding() != null) {
            return upload.getEncoding();
        }
        TextEncoding configured = properties.getStore().getDefaultEncoding();
        if (configured != null) {
            return configured;
        }
        return textCodec.detectDefaultEncoding(upload.getText());
    }

    private TextEncoding storedEncoding(ForecastEntity entity) {
        try {
            return TextEncoding.fromName(entity.getTextEncoding());
        } catch (EncodingException e) {
            log.warn("Forecast {} has unknown encoding '{}'", entity.getId(), entity.getTextEncoding());
            throw new ForecastDataCorruptedException(
                    "Stored forecast " + entity.getId() + " has an unknown encoding", e);
        }
    }

    private String decodeText(ForecastEntity entity, TextEncoding encoding) {
        try {
            return textCodec.decode(entity.getForecastText(), encoding);
        } catch (DecodingException e) {
            log.warn("Forecast {} cannot be decoded as {}", entity.getId(), encoding);
            throw new ForecastDataCorruptedException(
                    "Stored forecast " + entity.getId() + " cannot be decoded", e);
        }
    }

    private ForecastSummary toSummary(ForecastSummaryView row, Instant now) {
        return ForecastSummary.builder()
                .id(row.getId())
                .city(row.getCity())
                .forecastAt(row.getForecastAt())
                .expiresAt(row.getExpiresAt())
                .expired(row.getExpiresAt().isBefore(now))
                .sizes(ForecastSizes.of(row.getTextSizeBytes(), row.getAudioSizeBytes()))
                .encoding(row.getTextEncoding())
                .language(row.getTextLanguage())
                .locale(row.getTextLocale())
                .createdAt(row.getCreatedAt())
                .build();
    }

    private static StorageStatistics.CityStatistics toCityStatistics(CityStatisticsView row) {
        return StorageStatistics.CityStatistics.builder()
                .city(row.getCity())
                .forecastCount(nullToZero(row.getForecastCount()))
                .totalTextBytes(nullToZero(row.getTotalTextBytes()))
                .totalAudioBytes(nullToZero(row.getTotalAudioBytes()))
                .latestForecast(row.getLatestForecast())
                .build();
    }

    private static Map<String, Long> toHistogram(List<LabelCountView> rows) {
        return rows.stream()
                .collect(Collectors.toMap(
                        LabelCountView::getLabel,
                        row -> nullToZero(row.getOccurrences()),
                        Long::sum,
                        TreeMap::new));
    }

    private boolean tableExists(DatabaseMetaData metaData) throws SQLException {
        // H2 reports unquoted identifiers upper-case, PostgreSQL lower-case
        for (String name : List.of(TABLE_NAME, TABLE_NAME.toUpperCase(Locale.ROOT))) {
            try (ResultSet tables = metaData.getTables(null, null, name, new String[]{"TABLE"})) {
                if (tables.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static ConnectionStatus unreachable(String instanceId) {
        return ConnectionStatus.builder()
                .connected(false)
                .instanceId(instanceId != null ? instanceId : "not configured")
                .schemaReady(false)
                .error("Backing store unreachable")
                .build();
    }

    private Duration defaultTimeout() {
        return properties.getStore().getOperationTimeout();
    }

    static int toTimeoutSeconds(Duration timeout) {
        long millis = Math.max(1, timeout.toMillis());
        return (int) Math.min(Integer.MAX_VALUE, (millis + 999) / 1000);
    }

    static String normalizeCity(String city) {
        if (city == null || city.isBlank()) {
            throw new IllegalArgumentException("City must not be empty");
        }
        String normalized = city.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() > MAX_CITY_LENGTH) {
            throw new IllegalArgumentException("City must be at most " + MAX_CITY_LENGTH + " characters");
        }
        return normalized;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String stripQuery(String url) {
        if (url == null) {
            return null;
        }
        int query = url.indexOf('?');
        return query >= 0 ? url.substring(0, query) : url;
    }

    private static long nullToZero(Long value) {
        return value != null ? value : 0L;
    }
}
