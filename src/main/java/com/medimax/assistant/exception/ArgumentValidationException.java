package com.medimax.assistant.exception;

import lombok.Getter;

/**
 * Tool arguments did not satisfy the declared schema.
 */
@Getter
public class ArgumentValidationException extends MediMaxException {

    private final String toolName;
    private final String field;

    public ArgumentValidationException(String toolName, String field, String reason) {
        super(ErrorCategory.VALIDATION,
            "Invalid argument '" + field + "' for tool '" + toolName + "': " + reason);
        this.toolName = toolName;
        this.field = field;
    }
}
