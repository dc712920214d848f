package com.clarity.serving.service.inference;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Decoded model heads, all scores in model units.
 *
 * Sleep metric slots: 0 efficiency (fraction), 1 onset latency (hours), 2 wake after sleep
 * onset (hours), 3 total sleep time (half-days), 4 fragmentation, 5-7 confidence.
 */
@Value
@Builder
public class ModelOutput {

    public static final int SLEEP_METRIC_COUNT = 8;

    float[] sleepMetrics;
    float circadianScore;
    float depressionRisk;

    @Builder.Default
    float[] embedding = new float[0];

    @Singular
    List<String> sleepStages;
}
