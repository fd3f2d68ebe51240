package com.meddollina.assistant.model;

import jakarta.validation.constraints.NotNull;

public record ChatTurn(
        @NotNull ChatMessageRole role,
        String content
) {
    public static ChatTurn system(String content) {
        return new ChatTurn(ChatMessageRole.SYSTEM, content);
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(ChatMessageRole.USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(ChatMessageRole.ASSISTANT, content);
    }
}
