package com.medimax.assistant.exception;

import lombok.Getter;

/**
 * Wraps the last transient failure once a retry policy has run out of attempts.
 *
 * <p>Not itself transient: an outer retry loop must not multiply the inner one.
 */
@Getter
public class FinalErrorException extends MediMaxException {

    private final String operation;
    private final int attempts;

    public FinalErrorException(String operation, int attempts, Throwable lastError) {
        super(ErrorCategory.RETRIES_EXHAUSTED,
            operation + " failed after " + attempts + " attempt(s): " + lastError.getMessage(), lastError);
        this.operation = operation;
        this.attempts = attempts;
    }
}
