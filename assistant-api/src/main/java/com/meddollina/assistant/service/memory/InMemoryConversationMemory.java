package com.meddollina.assistant.service.memory;

import com.meddollina.assistant.model.ChatTurn;
import com.meddollina.assistant.model.ConversationTurn;

import java.util.ArrayList;
import java.util.List;

public class InMemoryConversationMemory implements ConversationMemory {

    private final List<ChatTurn> turns = new ArrayList<>();

    @Override
    public synchronized List<ChatTurn> loadHistory(String question) {
        return List.copyOf(turns);
    }

    @Override
    public synchronized void saveTurn(String question, String answer) {
        turns.addAll(new ConversationTurn(question, answer).toMessages());
    }

    public synchronized int size() {
        return turns.size();
    }
}
