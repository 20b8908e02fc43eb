package com.meteocache.controller;

import com.meteocache.config.MeteoCacheProperties;
import com.meteocache.model.dto.CurrentForecast;
import com.meteocache.model.dto.ErrorResponse;
import com.meteocache.model.dto.ForecastSummary;
import com.meteocache.model.dto.HistoryResponse;
import com.meteocache.model.dto.LanguageForecast;
import com.meteocache.service.ForecastStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read side of the forecast store: current forecast, history and language listings.
 */
@Slf4j
@RestController
@RequestMapping("/forecast")
public class ForecastController {

    private final ForecastStore forecastStore;
    private final MeteoCacheProperties properties;

    public ForecastController(ForecastStore forecastStore, MeteoCacheProperties properties) {
        this.forecastStore = forecastStore;
        this.properties = properties;
    }

    /**
     * Latest valid forecast for a city.
     *
     * @param city     city name, case-insensitive
     * @param language optional ISO 639-1 filter
     * @return 200 with the forecast, 404 when nothing valid is cached
     */
    @GetMapping("/{city}")
    public ResponseEntity<?> getCurrent(
            @PathVariable String city,
            @RequestParam(required = false) String language) {

        CurrentForecast forecast = forecastStore.getCurrent(city, language);
        if (!forecast.isFound()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.of("No valid forecast found for " + city));
        }
        return ResponseEntity.ok(forecast);
    }

    /**
     * Forecast history for a city, newest first.
     *
     * @param limit          1 to {@code meteocache.store.max-history-limit}
     * @param includeExpired whether expired records are returned
     */
    @GetMapping("/{city}/history")
    public ResponseEntity<?> getHistory(
            @PathVariable String city,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "false") boolean includeExpired) {

        int maxLimit = properties.getStore().getMaxHistoryLimit();
        if (limit < 1 || limit > maxLimit) {
            return ResponseEntity.badRequest()
                    .body(ErrorResponse.of("limit must be between 1 and " + maxLimit));
        }

        List<ForecastSummary> forecasts = forecastStore.list(city, limit);
        if (!includeExpired) {
            forecasts = forecasts.stream()
                    .filter(forecast -> !forecast.isExpired())
                    .collect(Collectors.toList());
        }

        return ResponseEntity.ok(HistoryResponse.builder()
                .city(city)
                .count(forecasts.size())
                .forecasts(forecasts)
                .build());
    }

    /**
     * Valid forecasts in one language, optionally for one city.
     */
    @GetMapping
    public ResponseEntity<List<LanguageForecast>> getByLanguage(
            @RequestParam String language,
            @RequestParam(required = false) String city) {

        return ResponseEntity.ok(forecastStore.listByLanguage(language, city));
    }
}
