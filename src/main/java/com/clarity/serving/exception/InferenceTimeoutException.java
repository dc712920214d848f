package com.clarity.serving.exception;

/**
 * A request did not complete within {@code clarity.batch.request-timeout}.
 */
public class InferenceTimeoutException extends InferenceException {

    public InferenceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
