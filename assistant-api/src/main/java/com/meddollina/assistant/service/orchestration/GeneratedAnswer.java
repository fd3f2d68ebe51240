package com.meddollina.assistant.service.orchestration;

public record GeneratedAnswer(
        String text,
        int inputTokens,
        int outputTokens,
        GenerationParameters parameters,
        boolean truncated
) {

    public long tokensUsed() {
        return (long) inputTokens + outputTokens;
    }
}
