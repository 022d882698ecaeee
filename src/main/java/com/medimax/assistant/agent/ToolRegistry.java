package com.medimax.assistant.agent;

import com.medimax.assistant.exception.UnknownToolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Name to tool lookup with argument validation before dispatch.
 *
 * <p>Populated once from every {@link Tool} bean at startup and only read
 * afterwards. Adding a tool means adding a bean.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ToolRegistry {

    private final ConcurrentMap<String, Tool> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<Tool> tools) {
        tools.forEach(this::register);
        log.info("Registered {} tools: {}", this.tools.size(), names());
    }

    /**
     * @throws IllegalStateException if a tool with the same name is already registered
     */
    public void register(Tool tool) {
        Tool existing = tools.putIfAbsent(tool.getName(), tool);
        if (existing != null) {
            throw new IllegalStateException("Duplicate tool name '" + tool.getName() + "': "
                + existing.getClass().getSimpleName() + " and " + tool.getClass().getSimpleName());
        }
    }

    public List<ToolDescriptor> list() {
        return tools.values().stream()
            .map(Tool::describe)
            .sorted(Comparator.comparing(ToolDescriptor::name))
            .toList();
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(name).map(tools::get);
    }

    public List<String> names() {
        return tools.keySet().stream().sorted().toList();
    }

    /**
     * Validates the call's arguments, then runs the tool.
     *
     * @throws UnknownToolException if no tool has that name
     * @throws com.medimax.assistant.exception.ArgumentValidationException if an argument violates the schema;
     *         the tool is not run
     */
    public ToolResult invoke(ToolCall call, ToolContext context) {
        Tool tool = find(call.toolName()).orElseThrow(() -> new UnknownToolException(call.toolName(), names()));
        Map<String, Object> arguments = ArgumentValidator.validate(tool.getName(), tool.getArgumentSchema(), call.arguments());
        log.info("Executing tool {} (attempt {})", tool.getName(), call.attemptNumber());
        return tool.execute(arguments, context);
    }

    public ToolResult invoke(String name, Map<String, Object> arguments, ToolContext context) {
        return invoke(new ToolCall(name, arguments, 1), context);
    }
}
