package com.clarity.serving.exception;

/**
 * Model compilation failed; the uncompiled model stays in service.
 */
public class CompilationException extends ServingException {

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
