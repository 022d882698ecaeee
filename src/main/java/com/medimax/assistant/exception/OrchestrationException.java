package com.medimax.assistant.exception;

/**
 * The agent run could not complete: malformed plans, reasoning service
 * unavailable, or budget exhausted.
 */
public class OrchestrationException extends MediMaxException {

    public OrchestrationException(String message) {
        super(ErrorCategory.ORCHESTRATION, message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(ErrorCategory.ORCHESTRATION, message, cause);
    }
}
