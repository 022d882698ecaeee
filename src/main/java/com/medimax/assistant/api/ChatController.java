package com.medimax.assistant.api;

import com.medimax.assistant.agent.AgentRunResult;
import com.medimax.assistant.agent.MedicalAssistantAgent;
import com.medimax.assistant.exception.OrchestrationException;
import com.medimax.assistant.model.conversation.ConversationState;
import com.medimax.assistant.service.ConversationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for chat API.
 *
 * Flow:
 * 1. Load the session's recent turns (or open a new session)
 * 2. MedicalAssistantAgent answers the message using tools
 * 3. The user message and answer are stored under the session
 * 4. Response returned with the tool trace
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
public class ChatController {

    private final MedicalAssistantAgent agent;
    private final ConversationService conversationService;

    /**
     * Send a chat message.
     *
     * POST /api/v1/chat
     *
     * Answers 503 when the run is aborted; the user turn is still stored.
     */
    @PostMapping
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        ConversationState state = conversationService.openSession(request.getSessionId());
        log.info("Chat message for session {}", state.getSessionId());

        AgentRunResult result = agent.run(request.getMessage().trim(), state);
        conversationService.saveNewTurns(state);

        if (!result.isCompleted()) {
            throw new OrchestrationException(result.getResponse());
        }

        return ResponseEntity.ok(ChatResponse.builder()
            .response(result.getResponse())
            .sessionId(state.getSessionId())
            .iterations(result.getIterations())
            .toolTrace(result.getTrace())
            .build());
    }

    /**
     * GET /api/v1/chat/{sessionId}/history
     */
    @GetMapping("/{sessionId}/history")
    public ResponseEntity<ConversationHistory> getHistory(@PathVariable String sessionId) {
        return ResponseEntity.ok(ConversationHistory.builder()
            .sessionId(sessionId)
            .turns(conversationService.getHistory(sessionId))
            .build());
    }

    /**
     * DELETE /api/v1/chat/{sessionId}
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Map<String, Object>> clearSession(@PathVariable String sessionId) {
        long removed = conversationService.clearSession(sessionId);
        return ResponseEntity.ok(Map.of("sessionId", sessionId, "turnsRemoved", removed));
    }
}
