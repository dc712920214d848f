package com.clarity.serving.exception;

/**
 * Neither the primary model nor the baseline model can serve.
 */
public class FallbackExhaustedException extends ServingException {

    public FallbackExhaustedException(String message) {
        super(message);
    }

    public FallbackExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
