package com.medimax.assistant.model.conversation;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one agent run. Created per request from the stored history
 * and discarded when the run ends; never shared between requests.
 */
@Getter
public class ConversationState {

    private final String sessionId;
    private final List<ConversationTurn> history;
    private final List<ToolTraceEntry> toolTrace = new ArrayList<>();
    private final int priorTurnCount;
    private int iterationCount;
    private int planFailures;

    public ConversationState(String sessionId, List<ConversationTurn> priorTurns) {
        this.sessionId = sessionId;
        this.history = new ArrayList<>(priorTurns);
        this.priorTurnCount = priorTurns.size();
    }

    public static ConversationState start(String sessionId) {
        return new ConversationState(sessionId, List.of());
    }

    public void append(ConversationTurn turn) {
        history.add(turn);
    }

    public void recordTool(ToolTraceEntry entry) {
        toolTrace.add(entry);
    }

    public int nextIteration() {
        return ++iterationCount;
    }

    public int recordPlanFailure() {
        return ++planFailures;
    }

    /**
     * Turns added during this run, in order.
     */
    public List<ConversationTurn> newTurns() {
        return Collections.unmodifiableList(history.subList(priorTurnCount, history.size()));
    }

    public List<ConversationTurn> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public List<ToolTraceEntry> getToolTrace() {
        return Collections.unmodifiableList(toolTrace);
    }
}
