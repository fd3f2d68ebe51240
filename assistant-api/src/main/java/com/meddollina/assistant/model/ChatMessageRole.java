package com.meddollina.assistant.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChatMessageRole {
    USER,
    ASSISTANT,
    SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChatMessageRole fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "user", "human" -> USER;
            case "assistant", "ai" -> ASSISTANT;
            case "system" -> SYSTEM;
            default -> throw new IllegalArgumentException("Unknown message role: " + value);
        };
    }
}
