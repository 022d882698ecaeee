package com.medimax.assistant.agent;

import com.medimax.assistant.exception.ErrorCategory;

/**
 * Outcome of a tool execution. Failures are data, not exceptions, so the
 * agent can show them to the model and keep going.
 *
 * @since 1.0.0
 */
public interface ToolResult {

    boolean isSuccess();

    /**
     * Tool output; for failures, optional structured error details.
     */
    Object getData();

    String getMessage();

    /**
     * Kind of failure, {@code null} on success.
     */
    ErrorCategory getErrorCategory();

    static ToolResult success(Object data, String message) {
        return new ToolResultImpl(true, data, message, null);
    }

    static ToolResult failure(String message) {
        return new ToolResultImpl(false, null, message, ErrorCategory.INTERNAL);
    }

    static ToolResult failure(String message, ErrorCategory category) {
        return new ToolResultImpl(false, null, message, category);
    }

    static ToolResult failure(String message, ErrorCategory category, Object data) {
        return new ToolResultImpl(false, data, message, category);
    }
}

record ToolResultImpl(
    boolean isSuccess,
    Object data,
    String message,
    ErrorCategory errorCategory
) implements ToolResult {

    @Override
    public boolean isSuccess() {
        return isSuccess;
    }

    @Override
    public Object getData() {
        return data;
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public ErrorCategory getErrorCategory() {
        return errorCategory;
    }
}
