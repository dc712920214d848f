package com.clarity.serving.exception;

/**
 * Request rejected at the service boundary.
 */
public class InvalidInputException extends ServingException {

    public InvalidInputException(String message) {
        super(message);
    }
}
