package com.medimax.assistant.agent;

import java.util.Map;

/**
 * One attempt at invoking a tool.
 *
 * @param attemptNumber 1 for the first attempt, incremented on each retry
 */
public record ToolCall(String toolName, Map<String, Object> arguments, int attemptNumber) {

    public ToolCall {
        arguments = arguments == null ? Map.of() : arguments;
    }

    public ToolCall nextAttempt() {
        return new ToolCall(toolName, arguments, attemptNumber + 1);
    }
}
