package com.meddollina.assistant.service.orchestration;

/**
 * The final answer could not be produced after every attempt. Callers must surface this
 * as an error result, never as an answer.
 */
public class GenerationFailedException extends RuntimeException {

    private final int attempts;

    public GenerationFailedException(int attempts, Throwable cause) {
        super("Answer generation failed after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
