package com.meddollina.assistant.service.orchestration;

import com.meddollina.assistant.model.GenerationRequest;
import com.meddollina.assistant.model.RequestPurpose;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class HeadingGenerator {

    private static final Logger log = LoggerFactory.getLogger(HeadingGenerator.class);

    static final int MAX_TOKENS = 12;
    static final double TEMPERATURE = 0.5;
    static final int FALLBACK_CHARS = 50;

    private final ChatCompletionClient chatClient;
    private final PromptFactory promptFactory;

    public HeadingGenerator(ChatCompletionClient chatClient, PromptFactory promptFactory) {
        this.chatClient = chatClient;
        this.promptFactory = promptFactory;
    }

    public String generate(String question) {
        GenerationRequest request = GenerationRequest.of(RequestPurpose.HEADING, promptFactory.heading(question), MAX_TOKENS)
                .withSampling(TEMPERATURE, null);
        try {
            String heading = stripQuotes(chatClient.complete(request));
            return heading.isEmpty() ? fallback(question) : heading;
        } catch (RuntimeException ex) {
            log.warn("Heading generation failed: {}", ex.getMessage());
            return fallback(question);
        }
    }

    public static String fallback(String question) {
        String text = question == null ? "" : question;
        return (text.length() > FALLBACK_CHARS ? text.substring(0, FALLBACK_CHARS) : text) + "...";
    }

    private static String stripQuotes(String raw) {
        if (raw == null) {
            return "";
        }
        String heading = raw.strip();
        int start = 0;
        int end = heading.length();
        while (start < end && heading.charAt(start) == '"') {
            start++;
        }
        while (end > start && heading.charAt(end - 1) == '"') {
            end--;
        }
        return heading.substring(start, end).strip();
    }
}
