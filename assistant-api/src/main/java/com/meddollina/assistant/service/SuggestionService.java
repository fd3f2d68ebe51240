package com.meddollina.assistant.service;

import com.meddollina.assistant.model.GenerationRequest;
import com.meddollina.assistant.model.RequestPurpose;
import com.meddollina.assistant.service.orchestration.ChatCompletionClient;
import com.meddollina.assistant.service.orchestration.PromptFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Example questions for the chat start screen. Each suggestion uses its index as the
 * sampling seed so a batch does not repeat itself.
 */
@Service
public class SuggestionService {

    private static final Logger log = LoggerFactory.getLogger(SuggestionService.class);

    static final int MAX_TOKENS = 20;
    static final double TEMPERATURE = 0.7;
    static final int MAX_SUGGESTIONS = 10;

    private final ChatCompletionClient chatClient;
    private final PromptFactory promptFactory;

    public SuggestionService(ChatCompletionClient chatClient, PromptFactory promptFactory) {
        this.chatClient = chatClient;
        this.promptFactory = promptFactory;
    }

    public List<String> suggest(int count) {
        int requested = Math.max(0, Math.min(count, MAX_SUGGESTIONS));
        List<String> suggestions = new ArrayList<>(requested);
        try {
            for (int seed = 0; seed < requested; seed++) {
                GenerationRequest request = GenerationRequest.of(RequestPurpose.SUGGESTION, promptFactory.suggestion(), MAX_TOKENS)
                        .withSampling(TEMPERATURE, null)
                        .withSeed(seed);
                suggestions.add(chatClient.complete(request).strip().replace("\n", ""));
            }
        } catch (RuntimeException ex) {
            log.warn("Suggestion generation failed: {}", ex.getMessage());
            return List.of();
        }
        return suggestions;
    }
}
