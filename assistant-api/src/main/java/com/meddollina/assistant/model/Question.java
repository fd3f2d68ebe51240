package com.meddollina.assistant.model;

import java.time.Instant;
import java.util.Objects;

public record Question(String text, Instant receivedAt) {

    public Question {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    public static Question of(String text) {
        return new Question(text, Instant.now());
    }
}
