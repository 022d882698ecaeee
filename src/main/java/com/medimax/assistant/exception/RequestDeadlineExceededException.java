package com.medimax.assistant.exception;

/**
 * The per-request time budget ran out while an outbound call was pending or
 * before the next one could start.
 */
public class RequestDeadlineExceededException extends OrchestrationException {

    public RequestDeadlineExceededException(String operation) {
        super("Request time budget exhausted during " + operation);
    }
}
