package com.medimax.assistant.exception;

/**
 * The graph database could not be reached.
 */
public class GraphConnectionException extends TransientException {

    public GraphConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
