package com.medimax.assistant.exception;

/**
 * Raised by synthesis when the produced node/edge set violates its
 * invariants. Fatal to that synthesis call; nothing reaches the store.
 */
public class GraphConsistencyException extends MediMaxException {

    public GraphConsistencyException(String message) {
        super(ErrorCategory.CONSISTENCY, message);
    }
}
