package com.clarity.serving.service.inference;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Heuristic model served when the transformer is unavailable.
 *
 * Sleep/wake per minute comes from Cole-Kripke weighted activity over the most recent day;
 * the circadian score is the interdaily stability of hourly activity over the whole window.
 * Expects standardized activity, so the sleep threshold is expressed in standard deviations.
 * Stateless and safe for concurrent use.
 */
@Slf4j
public class BaselineActigraphyModel implements InferenceModel {

    public static final String SLEEP = "sleep";
    public static final String WAKE = "wake";

    static final int MINUTES_PER_DAY = 1440;
    static final int MINUTES_PER_HOUR = 60;
    static final int HOURS_PER_DAY = 24;

    /**
     * Cole-Kripke one-minute epoch weights for offsets -4..+2.
     */
    private static final double[] WEIGHTS = {106, 54, 58, 76, 230, 74, 67};
    private static final int WEIGHT_OFFSET = 4;
    private static final double WEIGHT_SUM = 665.0;

    static final double SLEEP_THRESHOLD = -0.25;
    private static final float BASELINE_CONFIDENCE = 0.5f;
    private static final float NEUTRAL_RISK = 0.5f;

    private final String modelId;
    private final String version;

    public BaselineActigraphyModel(String modelId, String version) {
        this.modelId = modelId;
        this.version = version;
    }

    @Override
    public ModelOutput predict(float[] window) {
        int dayStart = Math.max(0, window.length - MINUTES_PER_DAY);
        boolean[] asleep = scoreSleep(window, dayStart);

        float[] metrics = new float[ModelOutput.SLEEP_METRIC_COUNT];
        SleepSummary summary = summarize(asleep);
        metrics[0] = (float) summary.efficiency();
        metrics[1] = (float) (summary.onsetLatencyMinutes() / MINUTES_PER_HOUR);
        metrics[2] = (float) (summary.wakeAfterOnsetMinutes() / MINUTES_PER_HOUR);
        metrics[3] = (float) (summary.sleepMinutes() / (double) MINUTES_PER_HOUR / 12.0);
        metrics[4] = (float) summary.fragmentation();
        metrics[5] = BASELINE_CONFIDENCE;
        metrics[6] = BASELINE_CONFIDENCE;
        metrics[7] = BASELINE_CONFIDENCE;

        List<String> stages = new ArrayList<>(asleep.length);
        for (boolean minute : asleep) {
            stages.add(minute ? SLEEP : WAKE);
        }

        return ModelOutput.builder()
                .sleepMetrics(metrics)
                .circadianScore((float) interdailyStability(window))
                .depressionRisk(NEUTRAL_RISK)
                .sleepStages(stages)
                .build();
    }

    /**
     * Sleep when the weighted activity around a minute is below {@link #SLEEP_THRESHOLD}.
     * Neighbours outside the window count as zero activity.
     */
    static boolean[] scoreSleep(float[] window, int from) {
        boolean[] asleep = new boolean[window.length - from];
        for (int t = from; t < window.length; t++) {
            double weighted = 0.0;
            for (int k = 0; k < WEIGHTS.length; k++) {
                int i = t + k - WEIGHT_OFFSET;
                if (i >= 0 && i < window.length) {
                    weighted += WEIGHTS[k] * window[i];
                }
            }
            asleep[t - from] = weighted / WEIGHT_SUM < SLEEP_THRESHOLD;
        }
        return asleep;
    }

    static SleepSummary summarize(boolean[] asleep) {
        int first = -1;
        int last = -1;
        int sleepMinutes = 0;
        int awakenings = 0;
        for (int i = 0; i < asleep.length; i++) {
            if (asleep[i]) {
                sleepMinutes++;
                if (first < 0) {
                    first = i;
                }
                last = i;
            } else if (i > 0 && asleep[i - 1]) {
                awakenings++;
            }
        }
        if (sleepMinutes == 0) {
            return new SleepSummary(0, 0.0, 0.0, 0.0, 0.0);
        }

        int span = last - first + 1;
        int longestStart = first;
        int longestLength = 0;
        int runStart = -1;
        for (int i = 0; i <= asleep.length; i++) {
            boolean sleeping = i < asleep.length && asleep[i];
            if (sleeping && runStart < 0) {
                runStart = i;
            } else if (!sleeping && runStart >= 0) {
                if (i - runStart > longestLength) {
                    longestLength = i - runStart;
                    longestStart = runStart;
                }
                runStart = -1;
            }
        }

        int latency = 0;
        for (int i = longestStart - 1; i >= 0 && !asleep[i]; i--) {
            latency++;
        }

        return new SleepSummary(
                sleepMinutes,
                (double) sleepMinutes / span,
                Math.min(latency, MINUTES_PER_HOUR),
                span - sleepMinutes,
                (double) awakenings / sleepMinutes);
    }

    /**
     * Interdaily stability over complete days of hourly means, 0 when fewer than two days.
     */
    static double interdailyStability(float[] window) {
        int days = window.length / MINUTES_PER_DAY;
        if (days < 2) {
            return 0.0;
        }
        int start = window.length - days * MINUTES_PER_DAY;
        int hours = days * HOURS_PER_DAY;

        double[] hourly = new double[hours];
        for (int h = 0; h < hours; h++) {
            double sum = 0.0;
            int count = 0;
            int from = start + h * MINUTES_PER_HOUR;
            for (int i = from; i < from + MINUTES_PER_HOUR; i++) {
                if (Float.isFinite(window[i])) {
                    sum += window[i];
                    count++;
                }
            }
            hourly[h] = count == 0 ? 0.0 : sum / count;
        }

        double mean = 0.0;
        for (double value : hourly) {
            mean += value;
        }
        mean /= hours;

        double[] profile = new double[HOURS_PER_DAY];
        for (int h = 0; h < hours; h++) {
            profile[h % HOURS_PER_DAY] += hourly[h] / days;
        }

        double between = 0.0;
        for (double value : profile) {
            between += (value - mean) * (value - mean);
        }
        double total = 0.0;
        for (double value : hourly) {
            total += (value - mean) * (value - mean);
        }
        if (total == 0.0) {
            return 0.0;
        }
        return (hours * between) / (HOURS_PER_DAY * total);
    }

    @Override
    public String modelId() {
        return modelId;
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public boolean isOptimized() {
        return false;
    }

    @Override
    public void close() {
        log.debug("Baseline model {}:{} released", modelId, version);
    }

    record SleepSummary(int sleepMinutes, double efficiency, double onsetLatencyMinutes,
                        double wakeAfterOnsetMinutes, double fragmentation) {
    }
}
