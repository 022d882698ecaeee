package com.medimax.assistant.exception;

/**
 * Retry-eligible failure: network trouble, timeouts, busy back ends.
 */
public class TransientException extends MediMaxException {

    public TransientException(String message) {
        super(ErrorCategory.TRANSIENT, message);
    }

    public TransientException(String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT, message, cause);
    }
}
