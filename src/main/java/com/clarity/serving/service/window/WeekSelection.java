package com.clarity.serving.service.window;

/**
 * Which complete weeks {@link WindowNormalizer#sliceToWeeks} returns.
 */
public enum WeekSelection {
    /**
     * Only the most recent complete week.
     */
    LATEST,

    /**
     * Every complete week, oldest first.
     */
    ALL
}
