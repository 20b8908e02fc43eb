package com.meteocache.controller;

import com.meteocache.model.dto.ConnectionStatus;
import com.meteocache.model.dto.HealthResponse;
import com.meteocache.service.ForecastStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Health probe of the backing store.
 */
@Slf4j
@RestController
public class HealthController {

    private final ForecastStore forecastStore;
    private final Clock clock;

    public HealthController(ForecastStore forecastStore, Clock clock) {
        this.forecastStore = forecastStore;
        this.clock = clock;
    }

    /**
     * @return 200 when the store is reachable and the schema exists, 503 otherwise
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        ConnectionStatus status = forecastStore.testConnection();
        HealthResponse response = HealthResponse.builder()
                .status(status.isHealthy() ? "healthy" : "unhealthy")
                .timestamp(clock.instant())
                .database(status)
                .build();

        if (!status.isHealthy()) {
            log.warn("Health check failed: connected={}, schemaReady={}", status.isConnected(), status.isSchemaReady());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
