package com.meddollina.assistant.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Urgency {
    LOW,
    MEDIUM,
    HIGH,
    BLOCKED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Urgency fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Urgency urgency : values()) {
            if (urgency.wireName().equals(normalized)) {
                return urgency;
            }
        }
        throw new IllegalArgumentException("Unknown urgency: " + value);
    }
}
