package com.meddollina.assistant.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Intent {
    MEDICAL,
    SPECIFIC_INFO,
    QUICK_ANSWER,
    EMERGENCY,
    FOLLOW_UP,
    CLARIFICATION_NEEDED,
    MALICIOUS,
    FULL_ANALYSIS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Strict lookup: anything other than one of the known wire names is rejected.
     */
    public static Intent fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Intent is missing");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Intent intent : values()) {
            if (intent.wireName().equals(normalized)) {
                return intent;
            }
        }
        throw new IllegalArgumentException("Unknown intent: " + value);
    }
}
