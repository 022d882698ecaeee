package com.medimax.assistant.exception;

import lombok.Getter;

import java.util.List;

/**
 * The requested tool is not registered.
 */
@Getter
public class UnknownToolException extends MediMaxException {

    private final String toolName;

    public UnknownToolException(String toolName, List<String> availableTools) {
        super(ErrorCategory.VALIDATION,
            "Tool '" + toolName + "' does not exist. Valid tools: " + String.join(", ", availableTools));
        this.toolName = toolName;
    }
}
