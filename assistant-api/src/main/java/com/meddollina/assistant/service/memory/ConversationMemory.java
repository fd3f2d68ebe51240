package com.meddollina.assistant.service.memory;

import com.meddollina.assistant.model.ChatTurn;

import java.util.List;

/**
 * Conversation memory that owns its history; the pipeline reads it and appends one turn
 * after each answered question.
 */
public interface ConversationMemory {

    List<ChatTurn> loadHistory(String question);

    void saveTurn(String question, String answer);
}
