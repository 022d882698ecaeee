package com.medimax.assistant.agent;

/**
 * States of one agent run. {@code COMPLETED} and {@code ABORTED} are terminal.
 */
public enum AgentState {
    AWAITING_PLAN,
    EXECUTING_TOOL,
    FOLDING_RESULT,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
