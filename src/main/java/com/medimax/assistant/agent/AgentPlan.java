package com.medimax.assistant.agent;

import java.util.Map;

/**
 * What the reasoning model decided for the next step.
 */
public interface AgentPlan {

    record FinalAnswer(String answer) implements AgentPlan {
    }

    record ToolInvocation(String toolName, Map<String, Object> arguments) implements AgentPlan {
    }

    /**
     * The response could not be understood; {@code reason} is shown to the model on the next attempt.
     */
    record Malformed(String reason, String rawResponse) implements AgentPlan {
    }
}
