package com.clarity.serving.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Actigraphy series for one user, oldest sample first.
 */
@Value
@Builder
@Jacksonized
public class ActigraphyInput {

    String userId;

    @Singular
    List<ActigraphyDataPoint> dataPoints;

    /**
     * Samples per minute.
     */
    @Builder.Default
    double samplingRate = 1.0;

    /**
     * Sample values in chronological order, narrowed to float32.
     */
    public float[] values() {
        float[] values = new float[dataPoints.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) dataPoints.get(i).getValue();
        }
        return values;
    }
}
