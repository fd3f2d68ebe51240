package com.meddollina.assistant.service.retrieval;

import java.util.Locale;

public enum SearchMode {
    SIMILARITY,
    /** Maximal marginal relevance: trades raw similarity for diversity among the results. */
    MMR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SearchMode fromWireName(String value) {
        for (SearchMode mode : values()) {
            if (mode.wireName().equalsIgnoreCase(value == null ? "" : value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown search mode: " + value);
    }
}
