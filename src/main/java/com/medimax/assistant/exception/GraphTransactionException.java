package com.medimax.assistant.exception;

/**
 * A graph write transaction failed and was rolled back. Retryable up to the
 * bound of the {@code graph} policy.
 */
public class GraphTransactionException extends TransientException {

    public GraphTransactionException(String message) {
        super(message);
    }

    public GraphTransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
