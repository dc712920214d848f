package com.clarity.serving.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Single activity sample.
 */
@Value
@Builder
@Jacksonized
public class ActigraphyDataPoint {

    Instant timestamp;

    /**
     * Activity count or acceleration magnitude.
     */
    double value;

    public static ActigraphyDataPoint of(Instant timestamp, double value) {
        return new ActigraphyDataPoint(timestamp, value);
    }
}
