package com.medimax.assistant.agent;

/**
 * Public description of a tool: what the model sees and {@code GET /api/v1/tools} returns.
 */
public record ToolDescriptor(String name, String description, Tool.ToolCategory category, ArgumentSchema argumentSchema) {
}
