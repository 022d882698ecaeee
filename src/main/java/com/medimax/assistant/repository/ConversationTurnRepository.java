package com.medimax.assistant.repository;

import com.medimax.assistant.model.conversation.ConversationTurnEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationTurnRepository extends JpaRepository<ConversationTurnEntity, Long> {

    List<ConversationTurnEntity> findBySessionIdOrderByIdAsc(String sessionId);

    /**
     * Newest turns first; callers reverse to restore order.
     */
    List<ConversationTurnEntity> findBySessionIdOrderByIdDesc(String sessionId, Pageable pageable);

    long countBySessionId(String sessionId);

    long deleteBySessionId(String sessionId);
}
