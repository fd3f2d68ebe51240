package com.meddollina.assistant.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ChatRequest(
        @NotBlank String message,
        @JsonProperty("conversation_id") String conversationId,
        List<@NotNull @Valid ChatTurn> history
) {
}
