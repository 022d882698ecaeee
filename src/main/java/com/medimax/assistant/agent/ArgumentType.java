package com.medimax.assistant.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ArgumentType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    OBJECT;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
