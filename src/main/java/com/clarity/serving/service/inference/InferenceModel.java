package com.clarity.serving.service.inference;

/**
 * Loaded model able to score one actigraphy window.
 * Implementations must allow concurrent {@link #predict} calls.
 */
public interface InferenceModel extends AutoCloseable {

    /**
     * Get model identifier.
     *
     * @return model id, e.g. "pat"
     */
    String modelId();

    /**
     * Get model version.
     *
     * @return version string, e.g. "1.1.0"
     */
    String version();

    /**
     * Check if this handle is the product of a compilation pass.
     *
     * @return true if compiled
     */
    boolean isOptimized();

    /**
     * Score a fixed-length window.
     *
     * @param window normalized window
     * @return decoded model heads
     * @throws com.clarity.serving.exception.InferenceException if scoring fails
     */
    ModelOutput predict(float[] window);

    /**
     * Release native resources. Never throws.
     */
    @Override
    void close();
}
