package com.clarity.serving.exception;

import lombok.Getter;

/**
 * A model version could not be brought to AVAILABLE.
 */
@Getter
public class ModelLoadException extends ServingException {

    private final String modelId;
    private final String version;

    public ModelLoadException(String modelId, String version, String message) {
        super(message);
        this.modelId = modelId;
        this.version = version;
    }

    public ModelLoadException(String modelId, String version, String message, Throwable cause) {
        super(message, cause);
        this.modelId = modelId;
        this.version = version;
    }
}
