package com.clarity.serving.service.window;

import org.springframework.stereotype.Component;

/**
 * Z-score standardization of activity values ahead of windowing.
 * Statistics are taken over finite samples only; non-finite samples are left as they are.
 */
@Component
public class ActivityStandardizer {

    public float[] standardize(float[] values) {
        int count = 0;
        double sum = 0.0;
        for (float v : values) {
            if (Float.isFinite(v)) {
                sum += v;
                count++;
            }
        }
        if (count < 2) {
            return values.clone();
        }

        double mean = sum / count;
        double squares = 0.0;
        for (float v : values) {
            if (Float.isFinite(v)) {
                double d = v - mean;
                squares += d * d;
            }
        }
        double std = Math.sqrt(squares / count);
        if (std == 0.0) {
            return values.clone();
        }

        float[] standardized = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            float v = values[i];
            standardized[i] = Float.isFinite(v) ? (float) ((v - mean) / std) : v;
        }
        return standardized;
    }
}
