package com.meteocache.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Liveness and readiness of the backing store.
 * {@code connected && !schemaReady} means reachable but the forecasts table is missing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionStatus {
    private boolean connected;
    private String instanceId;
    private String databaseName;
    private String version;
    private boolean schemaReady;

    /**
     * Generic failure description; driver messages are logged, not reported.
     */
    private String error;

    public boolean isHealthy() {
        return connected && schemaReady;
    }
}
