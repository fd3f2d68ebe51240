package com.meddollina.assistant.service.memory;

import com.meddollina.assistant.model.ChatTurn;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The two shapes conversation history arrives in: a flat list of messages supplied by the
 * caller, which the pipeline only reads, or a {@link ConversationMemory} it may append to.
 */
public final class ConversationContext {

    private static final ConversationContext NONE = new ConversationContext(List.of(), null);

    private final List<ChatTurn> flat;
    private final ConversationMemory memory;

    private ConversationContext(List<ChatTurn> flat, ConversationMemory memory) {
        this.flat = flat;
        this.memory = memory;
    }

    public static ConversationContext none() {
        return NONE;
    }

    public static ConversationContext flat(List<ChatTurn> messages) {
        if (messages == null) {
            return NONE;
        }
        List<ChatTurn> present = messages.stream().filter(Objects::nonNull).toList();
        return present.isEmpty() ? NONE : new ConversationContext(present, null);
    }

    public static ConversationContext structured(ConversationMemory memory) {
        return new ConversationContext(List.of(), memory);
    }

    public List<ChatTurn> messages(String question) {
        if (memory != null) {
            List<ChatTurn> history = memory.loadHistory(question);
            return history == null ? List.of() : history;
        }
        return flat;
    }

    public boolean isStructured() {
        return memory != null;
    }

    public Optional<ConversationMemory> memory() {
        return Optional.ofNullable(memory);
    }
}
