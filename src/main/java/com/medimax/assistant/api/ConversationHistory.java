package com.medimax.assistant.api;

import com.medimax.assistant.model.conversation.ConversationTurn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Stored turns of one chat session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationHistory {

    private String sessionId;

    @Builder.Default
    private List<ConversationTurn> turns = new ArrayList<>();
}
