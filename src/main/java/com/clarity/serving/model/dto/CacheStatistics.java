package com.clarity.serving.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result cache statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Entries currently held, expired ones excluded after maintenance.
     */
    private long size;

    private long hits;
    private long misses;

    /**
     * Hit rate (0.0-1.0).
     */
    private double hitRatio;

    /**
     * Entries evicted because they could not be decoded.
     */
    private long corruptEvictions;

    /**
     * Age of the oldest live entry in seconds, 0 when empty.
     */
    private double oldestEntryAgeSeconds;
}
