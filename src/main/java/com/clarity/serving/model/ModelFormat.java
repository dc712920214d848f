package com.clarity.serving.model;

/**
 * Artifact format of a registered model, used to pick its loader.
 */
public enum ModelFormat {
    /**
     * Exported graph executed by ONNX Runtime.
     */
    ONNX,

    /**
     * Built-in heuristic model; needs no artifact.
     */
    BASELINE
}
