package com.meteocache.controller;

import com.meteocache.model.dto.StorageStatistics;
import com.meteocache.service.ForecastStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatsController {

    private final ForecastStore forecastStore;

    public StatsController(ForecastStore forecastStore) {
        this.forecastStore = forecastStore;
    }

    @GetMapping("/stats")
    public ResponseEntity<StorageStatistics> getStats() {
        return ResponseEntity.ok(forecastStore.stats());
    }
}
