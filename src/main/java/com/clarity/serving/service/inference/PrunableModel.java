package com.clarity.serving.service.inference;

import java.util.Map;

/**
 * Model exposing its weight tensors for in-place pruning.
 */
public interface PrunableModel extends InferenceModel {

    /**
     * Mutable weight tensors keyed by layer name.
     */
    Map<String, float[]> weights();

    boolean isPruned();

    /**
     * Record that pruning was applied; pruning is never applied twice.
     */
    void markPruned();
}
