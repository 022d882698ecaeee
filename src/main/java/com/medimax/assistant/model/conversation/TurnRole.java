package com.medimax.assistant.model.conversation;

public enum TurnRole {
    USER,
    ASSISTANT,
    TOOL
}
