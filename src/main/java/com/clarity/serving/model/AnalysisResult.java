package com.clarity.serving.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Sleep and activity analysis for one actigraphy window.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnalysisResult {

    String userId;
    Instant analysisTimestamp;

    /**
     * Percentage 0-100.
     */
    double sleepEfficiency;

    /**
     * Minutes.
     */
    double sleepOnsetLatency;

    /**
     * Minutes awake after sleep onset.
     */
    double wakeAfterSleepOnset;

    /**
     * Hours.
     */
    double totalSleepTime;

    double circadianRhythmScore;
    double activityFragmentation;
    double depressionRiskScore;

    /**
     * Per-minute stage labels for the most recent day; empty when the model has no stage head.
     */
    List<String> sleepStages;

    double confidenceScore;
    List<String> clinicalInsights;

    /**
     * Pooled model embedding; immutable, empty when the model exposes none.
     */
    @Singular("embeddingValue")
    List<Float> embedding;

    AnalysisMetadata metadata;

    /**
     * Copy flagged as served from cache.
     */
    public AnalysisResult asCacheHit() {
        AnalysisMetadata source = metadata != null ? metadata : AnalysisMetadata.builder().build();
        return toBuilder()
                .metadata(source.toBuilder().cacheHit(true).build())
                .build();
    }
}
