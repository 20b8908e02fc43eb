package com.meteocache.controller;

import com.meteocache.codec.TextEncoding;
import com.meteocache.model.dto.CleanupResult;
import com.meteocache.model.dto.ForecastUpload;
import com.meteocache.model.dto.UploadForecastRequest;
import com.meteocache.model.dto.UploadResult;
import com.meteocache.service.ForecastStore;
import com.meteocache.service.ForecastTimestamps;
import com.meteocache.service.facade.ForecastCache;
import com.meteocache.service.facade.ForecastCacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin API: forecast upload and cache maintenance.
 */
@Slf4j
@RestController
@RequestMapping("/admin")
public class AdminController {

    private final ForecastStore forecastStore;
    private final ForecastCache forecastCache;

    public AdminController(ForecastStore forecastStore, ForecastCache forecastCache) {
        this.forecastStore = forecastStore;
        this.forecastCache = forecastCache;
    }

    /**
     * Upload a forecast.
     *
     * @param request JSON body; {@code audio} is base64, {@code forecastAt} ISO-8601
     * @return 201 with the stored record's id, expiry and sizes
     */
    @PostMapping("/forecasts")
    public ResponseEntity<UploadResult> upload(@RequestBody UploadForecastRequest request) {
        log.info("Admin: Uploading forecast for city={}, language={}", request.getCity(), request.getLanguage());

        ForecastUpload upload = ForecastUpload.builder()
                .city(request.getCity())
                .text(request.getText())
                .audio(request.getAudio())
                .forecastAt(ForecastTimestamps.parse(request.getForecastAt()))
                .ttlMinutes(request.getTtlMinutes())
                .encoding(request.getEncoding() != null ? TextEncoding.fromName(request.getEncoding()) : null)
                .language(request.getLanguage())
                .locale(request.getLocale())
                .build();

        UploadResult result = forecastStore.upload(upload);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    /**
     * Remove expired forecasts from the configured cache backend.
     */
    @PostMapping("/forecasts/cleanup")
    public ResponseEntity<CleanupResult> cleanup() {
        log.info("Admin: Cleaning up expired forecasts");
        return ResponseEntity.ok(forecastCache.cleanup());
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<ForecastCacheStats> getCacheStats() {
        log.info("Admin: Getting forecast cache statistics");
        return ResponseEntity.ok(forecastCache.stats());
    }
}
