package com.meddollina.assistant.model;

public enum AnswerOutcome {
    ANSWERED,
    REJECTED,
    BLOCKED,
    CLARIFICATION_NEEDED,
    VALIDATION_ERROR,
    GENERATION_FAILED;

    public boolean error() {
        return this == VALIDATION_ERROR || this == GENERATION_FAILED;
    }
}
