package com.clarity.serving.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Provenance of an analysis result.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnalysisMetadata {

    String modelId;
    String version;

    /**
     * Produced by a compiled model.
     */
    boolean optimized;

    /**
     * Served from the result cache.
     */
    boolean cacheHit;

    /**
     * Produced by the baseline model because the primary model was unavailable.
     */
    boolean fallback;
}
