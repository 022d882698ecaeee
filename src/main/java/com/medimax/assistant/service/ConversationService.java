package com.medimax.assistant.service;

import com.medimax.assistant.model.conversation.ConversationState;
import com.medimax.assistant.model.conversation.ConversationTurn;

import java.util.List;

/**
 * Stores chat turns per session and rebuilds the state an agent run starts from.
 */
public interface ConversationService {

    /**
     * Open a session for a new run. A null or blank id starts a fresh session.
     * The returned state holds at most {@code app.agent.history-window} prior turns.
     */
    ConversationState openSession(String sessionId);

    /**
     * Persist the user and assistant turns a run added to the state.
     */
    void saveNewTurns(ConversationState state);

    /**
     * All stored turns of a session, oldest first.
     */
    List<ConversationTurn> getHistory(String sessionId);

    /**
     * Delete a session's turns.
     *
     * @return number of turns removed
     */
    long clearSession(String sessionId);
}
