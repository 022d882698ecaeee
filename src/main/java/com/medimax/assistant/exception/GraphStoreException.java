package com.medimax.assistant.exception;

/**
 * Non-retryable graph store failure that is neither a syntax error nor a
 * connectivity problem.
 */
public class GraphStoreException extends MediMaxException {

    public GraphStoreException(String message) {
        super(ErrorCategory.INTERNAL, message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(ErrorCategory.INTERNAL, message, cause);
    }
}
