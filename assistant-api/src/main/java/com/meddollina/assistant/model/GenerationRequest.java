package com.meddollina.assistant.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record GenerationRequest(
        RequestPurpose purpose,
        List<ChatTurn> messages,
        int maxTokens,
        Double temperature,
        Double topP,
        Map<String, Object> responseFormat,
        Integer seed
) {

    public static final Map<String, Object> JSON_OBJECT = Map.of("type", "json_object");

    public GenerationRequest {
        Objects.requireNonNull(purpose, "purpose");
        messages = List.copyOf(messages);
        responseFormat = responseFormat == null ? Map.of() : Map.copyOf(responseFormat);
    }

    public static GenerationRequest of(RequestPurpose purpose, List<ChatTurn> messages, int maxTokens) {
        return new GenerationRequest(purpose, messages, maxTokens, null, null, null, null);
    }

    public GenerationRequest withSampling(Double temperature, Double topP) {
        return new GenerationRequest(purpose, messages, maxTokens, temperature, topP, responseFormat, seed);
    }

    public GenerationRequest withJsonResponse() {
        return new GenerationRequest(purpose, messages, maxTokens, temperature, topP, JSON_OBJECT, seed);
    }

    public GenerationRequest withSeed(Integer newSeed) {
        return new GenerationRequest(purpose, messages, maxTokens, temperature, topP, responseFormat, newSeed);
    }

    public boolean structured() {
        return !responseFormat.isEmpty();
    }
}
