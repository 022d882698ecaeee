package com.medimax.assistant.model.conversation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * What one tool execution received and returned. Exactly one of
 * {@code result} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolTraceEntry(String tool, Map<String, Object> arguments, Object result, String error) {

    public static ToolTraceEntry success(String tool, Map<String, Object> arguments, Object result) {
        return new ToolTraceEntry(tool, arguments, result, null);
    }

    public static ToolTraceEntry failure(String tool, Map<String, Object> arguments, String error) {
        return new ToolTraceEntry(tool, arguments, null, error);
    }
}
