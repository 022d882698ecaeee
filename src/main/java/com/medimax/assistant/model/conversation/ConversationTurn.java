package com.medimax.assistant.model.conversation;

/**
 * One entry of the conversation history. {@code toolName} is set for tool turns only.
 */
public record ConversationTurn(TurnRole role, String content, String toolName) {

    public static ConversationTurn user(String content) {
        return new ConversationTurn(TurnRole.USER, content, null);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(TurnRole.ASSISTANT, content, null);
    }

    public static ConversationTurn tool(String toolName, String content) {
        return new ConversationTurn(TurnRole.TOOL, content, toolName);
    }
}
