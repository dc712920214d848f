package com.clarity.serving.exception;

/**
 * The handle was released by an unload or reload before the prediction ran.
 */
public class ModelUnloadedException extends InferenceException {

    public ModelUnloadedException(String message) {
        super(message);
    }
}
