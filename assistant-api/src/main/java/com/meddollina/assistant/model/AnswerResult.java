package com.meddollina.assistant.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record AnswerResult(
        String answer,
        List<String> sources,
        String heading,
        Map<String, Object> metadata,
        AnswerOutcome outcome
) {

    public AnswerResult {
        Objects.requireNonNull(outcome, "outcome");
        sources = sources == null ? List.of() : List.copyOf(sources);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String intent() {
        Object intent = metadata.get("intent");
        return intent == null ? null : intent.toString();
    }
}
