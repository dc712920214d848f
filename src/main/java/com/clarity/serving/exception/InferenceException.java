package com.clarity.serving.exception;

/**
 * A single prediction failed. Other requests in the same batch are unaffected.
 */
public class InferenceException extends ServingException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
