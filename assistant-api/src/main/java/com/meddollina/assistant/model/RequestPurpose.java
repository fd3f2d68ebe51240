package com.meddollina.assistant.model;

public enum RequestPurpose {
    VALIDATION,
    INTENT_DETECTION,
    HEADING,
    REASONING,
    ANSWER,
    SUGGESTION
}
