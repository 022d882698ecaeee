package com.medimax.assistant.exception;

import lombok.Getter;

/**
 * Root of the application exception hierarchy.
 *
 * @since 1.0.0
 */
@Getter
public class MediMaxException extends RuntimeException {

    private final ErrorCategory category;

    public MediMaxException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public MediMaxException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public boolean isTransient() {
        return category == ErrorCategory.TRANSIENT;
    }
}
