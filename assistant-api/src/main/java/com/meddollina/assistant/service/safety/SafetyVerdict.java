package com.meddollina.assistant.service.safety;

public enum SafetyVerdict {
    SEXUAL_MISCONDUCT("I can't help with that request."),
    MALICIOUS_INTENT("I can't help with that request."),
    FAREWELL("Goodbye! It was nice interacting with you. Feel free to return if you have more questions.");

    private final String message;

    SafetyVerdict(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
