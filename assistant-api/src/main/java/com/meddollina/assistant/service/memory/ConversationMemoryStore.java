package com.meddollina.assistant.service.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ConversationMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationMemoryStore.class);

    private final Map<String, InMemoryConversationMemory> conversations = new ConcurrentHashMap<>();

    public ConversationMemory forConversation(String conversationId) {
        return conversations.computeIfAbsent(conversationId, key -> {
            log.debug("Starting memory for conversation {}", key);
            return new InMemoryConversationMemory();
        });
    }
}
