package com.meddollina.assistant.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record IntentResult(
        Intent intent,
        Urgency urgency,
        Optional<String> focusArea,
        Optional<String> mainCondition,
        Optional<String> needsClarification,
        boolean requiresFullStructure
) {

    public IntentResult {
        Objects.requireNonNull(intent, "intent");
        urgency = urgency == null ? Urgency.MEDIUM : urgency;
        focusArea = normalize(focusArea);
        mainCondition = normalize(mainCondition);
        needsClarification = normalize(needsClarification);
    }

    public static IntentResult of(Intent intent, Urgency urgency) {
        return new IntentResult(intent, urgency, Optional.empty(), Optional.empty(), Optional.empty(), false);
    }

    public static IntentResult malicious() {
        return new IntentResult(Intent.MALICIOUS, Urgency.BLOCKED,
                Optional.of("blocked"), Optional.of("malicious_request"), Optional.empty(), false);
    }

    public static IntentResult unavailable() {
        return new IntentResult(Intent.MEDICAL, Urgency.MEDIUM,
                Optional.of("general"), Optional.of("unknown"), Optional.empty(), false);
    }

    public static IntentResult unparseable() {
        return new IntentResult(Intent.FULL_ANALYSIS, Urgency.MEDIUM,
                Optional.empty(), Optional.empty(), Optional.empty(), true);
    }

    public IntentResult withIntent(Intent newIntent) {
        return new IntentResult(newIntent, urgency, focusArea, mainCondition, needsClarification, requiresFullStructure);
    }

    public IntentResult withFocusArea(String newFocusArea) {
        return new IntentResult(intent, urgency, Optional.ofNullable(newFocusArea), mainCondition, needsClarification, requiresFullStructure);
    }

    public IntentResult withMainCondition(String newMainCondition) {
        return new IntentResult(intent, urgency, focusArea, Optional.ofNullable(newMainCondition), needsClarification, requiresFullStructure);
    }

    public boolean hasFocusArea(String... candidates) {
        return focusArea.map(area -> {
            for (String candidate : candidates) {
                if (candidate.equals(area)) {
                    return true;
                }
            }
            return false;
        }).orElse(false);
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("intent", intent.wireName());
        metadata.put("focus_area", focusArea.orElse(""));
        metadata.put("urgency", urgency.wireName());
        metadata.put("main_condition", mainCondition.orElse(""));
        return metadata;
    }

    private static Optional<String> normalize(Optional<String> value) {
        if (value == null) {
            return Optional.empty();
        }
        return value.map(String::trim).filter(text -> !text.isEmpty());
    }
}
