package com.meteocache.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of an expiry sweep.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupResult {

    /**
     * Records (or files) removed by this sweep.
     */
    private long deletedCount;

    /**
     * Records (or files) left in the store after the sweep.
     */
    private long remainingCount;
}
