package com.clarity.serving.service.batch;

/**
 * Source of the model that should serve the next batch.
 */
public interface ServingModelProvider {

    /**
     * Resolve the serving model, loading it if needed.
     *
     * @return primary model, or the fallback model flagged as such
     * @throws com.clarity.serving.exception.FallbackExhaustedException if no model can serve
     */
    ServingModel servingModel();
}
