package com.meddollina.assistant.service.pipeline;

public enum PipelineEvents {
    VALIDATION_PASSED,
    VALIDATION_REJECTED,
    VALIDATION_ERROR,
    INTENT_RESOLVED,
    INTENT_MALICIOUS,
    INTENT_NEEDS_CLARIFICATION,
    DOCUMENTS_RETRIEVED,
    REASONING_COMPLETED,
    ANSWER_GENERATED,
    GENERATION_FAILED
}
