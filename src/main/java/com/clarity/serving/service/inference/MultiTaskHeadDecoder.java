package com.clarity.serving.service.inference;

import com.clarity.serving.exception.InferenceException;

import java.util.Arrays;

/**
 * Decodes the multi-task logits of the actigraphy transformer.
 * Logit layout: 0-7 sleep metrics, 8 circadian score, 9 depression risk, all through a sigmoid.
 */
public final class MultiTaskHeadDecoder {

    static final int MIN_LOGITS = ModelOutput.SLEEP_METRIC_COUNT + 2;

    private MultiTaskHeadDecoder() {
    }

    public static ModelOutput decode(float[] logits, float[] embedding) {
        if (logits == null || logits.length < MIN_LOGITS) {
            throw new InferenceException("Expected at least " + MIN_LOGITS + " logits, got "
                    + (logits == null ? 0 : logits.length));
        }

        float[] sleepMetrics = new float[ModelOutput.SLEEP_METRIC_COUNT];
        for (int i = 0; i < sleepMetrics.length; i++) {
            sleepMetrics[i] = sigmoid(logits[i]);
        }

        return ModelOutput.builder()
                .sleepMetrics(sleepMetrics)
                .circadianScore(sigmoid(logits[ModelOutput.SLEEP_METRIC_COUNT]))
                .depressionRisk(sigmoid(logits[ModelOutput.SLEEP_METRIC_COUNT + 1]))
                .embedding(embedding == null ? new float[0] : Arrays.copyOf(embedding, embedding.length))
                .build();
    }

    static float sigmoid(float x) {
        return (float) (1.0 / (1.0 + Math.exp(-x)));
    }
}
