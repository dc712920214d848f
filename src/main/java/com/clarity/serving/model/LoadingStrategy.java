package com.clarity.serving.model;

/**
 * When registered models are loaded.
 */
public enum LoadingStrategy {
    /**
     * Load every model during startup; a critical failure aborts startup.
     */
    EAGER,

    /**
     * Load on first request.
     */
    LAZY,

    /**
     * Load critical models first, then the rest, in the background.
     */
    PROGRESSIVE
}
