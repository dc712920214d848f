package com.clarity.serving.service;

import com.clarity.serving.model.AnalysisMetadata;
import com.clarity.serving.model.AnalysisResult;
import com.clarity.serving.service.batch.Prediction;
import com.clarity.serving.service.inference.ModelOutput;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts model heads into an {@link AnalysisResult}: clinical units plus insights.
 */
@Component
public class AnalysisAssembler {

    static final double EXCELLENT_SLEEP_EFFICIENCY = 85.0;
    static final double GOOD_SLEEP_EFFICIENCY = 75.0;
    static final double HIGH_CIRCADIAN_SCORE = 0.8;
    static final double MODERATE_CIRCADIAN_SCORE = 0.6;
    static final double HIGH_DEPRESSION_RISK = 0.7;
    static final double MODERATE_DEPRESSION_RISK = 0.4;

    public AnalysisResult assemble(String userId, Prediction prediction, Instant analysisTimestamp) {
        ModelOutput output = prediction.getOutput();
        float[] metrics = output.getSleepMetrics();

        double sleepEfficiency = metrics[0] * 100.0;
        double circadianScore = output.getCircadianScore();
        double depressionRisk = output.getDepressionRisk();

        return AnalysisResult.builder()
                .userId(userId)
                .analysisTimestamp(analysisTimestamp)
                .sleepEfficiency(sleepEfficiency)
                .sleepOnsetLatency(metrics[1] * 60.0)
                .wakeAfterSleepOnset(metrics[2] * 60.0)
                .totalSleepTime(metrics[3] * 12.0)
                .activityFragmentation(metrics[4])
                .confidenceScore((metrics[5] + metrics[6] + metrics[7]) / 3.0)
                .circadianRhythmScore(circadianScore)
                .depressionRiskScore(depressionRisk)
                .sleepStages(List.copyOf(output.getSleepStages()))
                .clinicalInsights(insights(sleepEfficiency, circadianScore, depressionRisk))
                .embedding(embedding(output.getEmbedding()))
                .metadata(AnalysisMetadata.builder()
                        .modelId(prediction.getModelId())
                        .version(prediction.getVersion())
                        .optimized(prediction.isOptimized())
                        .fallback(prediction.isFallback())
                        .cacheHit(false)
                        .build())
                .build();
    }

    private static List<Float> embedding(float[] values) {
        List<Float> embedding = new ArrayList<>(values.length);
        for (float value : values) {
            embedding.add(value);
        }
        return embedding;
    }

    List<String> insights(double sleepEfficiency, double circadianScore, double depressionRisk) {
        List<String> insights = new ArrayList<>(3);

        if (sleepEfficiency >= EXCELLENT_SLEEP_EFFICIENCY) {
            insights.add("Excellent sleep efficiency - maintaining healthy sleep patterns");
        } else if (sleepEfficiency >= GOOD_SLEEP_EFFICIENCY) {
            insights.add("Good sleep efficiency - minor room for improvement");
        } else {
            insights.add("Poor sleep efficiency - consider sleep hygiene improvements");
        }

        if (circadianScore >= HIGH_CIRCADIAN_SCORE) {
            insights.add("Strong circadian rhythm regularity");
        } else if (circadianScore >= MODERATE_CIRCADIAN_SCORE) {
            insights.add("Moderate circadian rhythm - consider regular sleep schedule");
        } else {
            insights.add("Irregular circadian rhythm - prioritize sleep consistency");
        }

        if (depressionRisk >= HIGH_DEPRESSION_RISK) {
            insights.add("Elevated depression risk indicators - consider professional consultation");
        } else if (depressionRisk >= MODERATE_DEPRESSION_RISK) {
            insights.add("Moderate mood-related patterns detected");
        } else {
            insights.add("Healthy mood-related activity patterns");
        }

        return insights;
    }
}
