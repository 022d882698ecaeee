package com.medimax.assistant.agent;

import com.medimax.assistant.model.conversation.ToolTraceEntry;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one agent run.
 */
@Value
@Builder
public class AgentRunResult {

    AgentState finalState;

    /**
     * Final answer when completed, explanation when aborted.
     */
    String response;

    List<ToolTraceEntry> trace;

    int iterations;

    int reasoningCalls;

    String abortReason;

    public boolean isCompleted() {
        return finalState == AgentState.COMPLETED;
    }
}
