package com.clarity.serving.exception;

/**
 * Base class for serving failures.
 */
public class ServingException extends RuntimeException {

    public ServingException(String message) {
        super(message);
    }

    public ServingException(String message, Throwable cause) {
        super(message, cause);
    }
}
