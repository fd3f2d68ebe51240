package com.meddollina.assistant.model;

import java.util.List;

public record ConversationTurn(String question, String answer) {

    public List<ChatTurn> toMessages() {
        return List.of(ChatTurn.user(question), ChatTurn.assistant(answer));
    }
}
