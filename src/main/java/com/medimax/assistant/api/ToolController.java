package com.medimax.assistant.api;

import com.medimax.assistant.agent.ToolDescriptor;
import com.medimax.assistant.agent.ToolRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lists the tools the agent can call, with their argument schemas.
 */
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry toolRegistry;

    @GetMapping
    public List<ToolDescriptor> listTools() {
        return toolRegistry.list();
    }
}
