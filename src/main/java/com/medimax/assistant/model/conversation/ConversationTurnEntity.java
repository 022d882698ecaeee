package com.medimax.assistant.model.conversation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted chat turn, keyed by session.
 */
@Data
@Entity
@Table(name = "CONVERSATION_TURNS", indexes = @Index(name = "idx_turn_session", columnList = "session_id"))
@NoArgsConstructor
public class ConversationTurnEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TurnRole role;

    @Lob
    @Column(nullable = false)
    private String content;

    @Column(name = "tool_name", length = 100)
    private String toolName;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public ConversationTurnEntity(String sessionId, ConversationTurn turn) {
        this.sessionId = sessionId;
        this.role = turn.role();
        this.content = turn.content();
        this.toolName = turn.toolName();
        this.createdAt = LocalDateTime.now();
    }

    public ConversationTurn toTurn() {
        return new ConversationTurn(role, content, toolName);
    }
}
