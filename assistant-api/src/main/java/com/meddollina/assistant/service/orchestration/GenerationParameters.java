package com.meddollina.assistant.service.orchestration;

import com.meddollina.assistant.model.IntentResult;
import com.meddollina.assistant.model.Urgency;

/**
 * Output length and sampling temperature for the final answer, chosen from the intent.
 */
public record GenerationParameters(int maxTokens, double temperature) {

    static final GenerationParameters QUICK_ANSWER = new GenerationParameters(800, 0.1);
    static final GenerationParameters EMERGENCY = new GenerationParameters(1000, 0.2);
    static final GenerationParameters DETAILED_PLAN = new GenerationParameters(1500, 0.2);
    static final GenerationParameters FOLLOW_UP = new GenerationParameters(1200, 0.2);
    static final GenerationParameters HIGH_URGENCY = new GenerationParameters(1000, 0.2);
    static final GenerationParameters DEFAULT = new GenerationParameters(1200, 0.3);

    // first match wins
    public static GenerationParameters forIntent(IntentResult intent) {
        switch (intent.intent()) {
            case QUICK_ANSWER:
                return QUICK_ANSWER;
            case EMERGENCY:
                return EMERGENCY;
            case SPECIFIC_INFO:
                if (intent.hasFocusArea("treatment", "surgical_plan", "medications")) {
                    return DETAILED_PLAN;
                }
                break;
            case FOLLOW_UP:
                return FOLLOW_UP;
            default:
                break;
        }
        if (intent.urgency() == Urgency.HIGH) {
            return HIGH_URGENCY;
        }
        return DEFAULT;
    }
}
