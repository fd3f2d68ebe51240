package com.meddollina.assistant.service.retry;

public class RetriesExhaustedException extends RuntimeException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastFailure) {
        super("All " + attempts + " attempts failed: " + (lastFailure == null ? "unknown error" : lastFailure.getMessage()), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
