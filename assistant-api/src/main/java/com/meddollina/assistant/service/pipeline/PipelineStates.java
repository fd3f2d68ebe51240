package com.meddollina.assistant.service.pipeline;

public enum PipelineStates {
    VALIDATING(false),
    REJECTED(true),
    INTENT_DETECTING(false),
    MALICIOUS(true),
    CLARIFICATION_NEEDED(true),
    RETRIEVING(false),
    REASONING(false),
    FINAL_GENERATION(false),
    DONE(true),
    FAILED(true);

    private final boolean terminal;

    PipelineStates(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean terminal() {
        return terminal;
    }
}
