package com.medimax.assistant.service.impl;

import com.medimax.assistant.config.AgentConfig;
import com.medimax.assistant.model.conversation.ConversationState;
import com.medimax.assistant.model.conversation.ConversationTurn;
import com.medimax.assistant.model.conversation.ConversationTurnEntity;
import com.medimax.assistant.model.conversation.TurnRole;
import com.medimax.assistant.repository.ConversationTurnRepository;
import com.medimax.assistant.service.ConversationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * JPA-backed session store. Tool turns live only inside a run; the stored
 * history keeps what the user asked and what the assistant answered.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationServiceImpl implements ConversationService {

    private final ConversationTurnRepository turnRepository;
    private final AgentConfig agentConfig;

    @Override
    @Transactional(readOnly = true)
    public ConversationState openSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            String created = UUID.randomUUID().toString();
            log.info("New session: {}", created);
            return ConversationState.start(created);
        }

        int window = Math.max(0, agentConfig.getHistoryWindow());
        if (window == 0) {
            return ConversationState.start(sessionId);
        }

        List<ConversationTurn> recent = new ArrayList<>();
        turnRepository.findBySessionIdOrderByIdDesc(sessionId, PageRequest.of(0, window))
            .forEach(entity -> recent.add(entity.toTurn()));
        Collections.reverse(recent);

        log.debug("Session {} resumed with {} prior turns", sessionId, recent.size());
        return new ConversationState(sessionId, recent);
    }

    @Override
    @Transactional
    public void saveNewTurns(ConversationState state) {
        List<ConversationTurnEntity> entities = state.newTurns().stream()
            .filter(turn -> turn.role() != TurnRole.TOOL)
            .map(turn -> new ConversationTurnEntity(state.getSessionId(), turn))
            .toList();

        turnRepository.saveAll(entities);
        log.debug("Saved {} turns for session {}", entities.size(), state.getSessionId());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationTurn> getHistory(String sessionId) {
        return turnRepository.findBySessionIdOrderByIdAsc(sessionId).stream()
            .map(ConversationTurnEntity::toTurn)
            .toList();
    }

    @Override
    @Transactional
    public long clearSession(String sessionId) {
        long removed = turnRepository.deleteBySessionId(sessionId);
        log.info("Cleared session {} ({} turns)", sessionId, removed);
        return removed;
    }
}
