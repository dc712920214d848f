package com.clarity.serving.service.optimization;

/**
 * Warm-up latencies in milliseconds.
 */
public record WarmUpStats(int iterations, double meanMillis, double minMillis, double maxMillis) {

    public static final WarmUpStats NONE = new WarmUpStats(0, 0.0, 0.0, 0.0);
}
