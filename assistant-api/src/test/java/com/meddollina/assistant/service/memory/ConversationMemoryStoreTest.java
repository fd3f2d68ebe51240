package com.meddollina.assistant.service.memory;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationMemoryStoreTest {

    private final ConversationMemoryStore store = new ConversationMemoryStore();

    @Test
    void sameIdSharesOneMemory() {
        ConversationMemory first = store.forConversation("conv-1");
        first.saveTurn("What is a hernia?", "A bulge.");

        assertThat(store.forConversation("conv-1")).isSameAs(first);
        assertThat(store.forConversation("conv-1").loadHistory("next")).hasSize(2);
        assertThat(store.forConversation("conv-2").loadHistory("next")).isEmpty();
    }
}
