package com.clarity.serving.service.window;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Maps variable-length activity series onto the fixed-length window a model consumes.
 *
 * Two truncation rules exist and are deliberately kept apart:
 * - {@link #prepare} keeps the most recent {@code target} samples (serving path)
 * - {@link #sliceToWeeks} drops the partial leading week and cuts whole weeks (multi-week analysis)
 *
 * Values are never sanitized: NaN and infinities pass through.
 */
@Slf4j
@Component
public class WindowNormalizer {

    public static final int WEEK_MINUTES = 10080;
    public static final float DEFAULT_FILL = 0.0f;

    public float[] prepare(float[] values) {
        return prepare(values, WEEK_MINUTES, DEFAULT_FILL);
    }

    /**
     * Prepare exactly {@code target} samples.
     *
     * @param values chronological samples, may be empty
     * @param target window length
     * @param fill   value for missing leading samples
     * @return new array of length {@code target}
     */
    public float[] prepare(float[] values, int target, float fill) {
        checkTarget(target);
        int length = values.length;

        if (length == target) {
            return Arrays.copyOf(values, target);
        }
        if (length < target) {
            log.debug("Padding series from {} to {} samples", length, target);
            return padToWeek(values, target, fill, PadSide.LEFT);
        }

        log.debug("Truncating series from {} to most recent {} samples", length, target);
        return Arrays.copyOfRange(values, length - target, length);
    }

    /**
     * Pad a series no longer than {@code target}.
     *
     * @throws IllegalArgumentException if the series is longer than {@code target}
     */
    public float[] padToWeek(float[] values, int target, float fill, PadSide side) {
        checkTarget(target);
        if (values.length > target) {
            throw new IllegalArgumentException(
                    "Series has " + values.length + " samples, exceeds target length " + target);
        }

        float[] window = new float[target];
        int padLength = target - values.length;
        if (side == PadSide.LEFT) {
            Arrays.fill(window, 0, padLength, fill);
            System.arraycopy(values, 0, window, padLength, values.length);
        } else {
            System.arraycopy(values, 0, window, 0, values.length);
            Arrays.fill(window, values.length, target, fill);
        }
        return window;
    }

    /**
     * Split a series into complete weeks, trimming the partial week at the start.
     *
     * @return week chunks, empty when less than one full week is available
     */
    public List<float[]> sliceToWeeks(float[] values, int minutesPerWeek, WeekSelection keep) {
        checkTarget(minutesPerWeek);
        if (values.length == 0) {
            log.warn("Empty series provided to sliceToWeeks");
            return Collections.emptyList();
        }
        if (values.length < minutesPerWeek) {
            log.info("Series has {} samples, less than one week ({}); no weeks returned",
                    values.length, minutesPerWeek);
            return Collections.emptyList();
        }

        int fullWeeks = values.length / minutesPerWeek;
        int start = values.length - fullWeeks * minutesPerWeek;
        if (start > 0) {
            log.info("Trimming {} leading samples to keep complete weeks", start);
        }

        if (keep == WeekSelection.LATEST) {
            int from = values.length - minutesPerWeek;
            return List.of(Arrays.copyOfRange(values, from, values.length));
        }

        List<float[]> weeks = new ArrayList<>(fullWeeks);
        for (int week = 0; week < fullWeeks; week++) {
            int from = start + week * minutesPerWeek;
            weeks.add(Arrays.copyOfRange(values, from, from + minutesPerWeek));
        }
        log.debug("Returning {} week chunks", weeks.size());
        return weeks;
    }

    public List<float[]> sliceToWeeks(float[] values, WeekSelection keep) {
        return sliceToWeeks(values, WEEK_MINUTES, keep);
    }

    private static void checkTarget(int target) {
        if (target <= 0) {
            throw new IllegalArgumentException("Target length must be positive: " + target);
        }
    }
}
