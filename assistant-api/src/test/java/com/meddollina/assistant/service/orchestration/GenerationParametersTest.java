package com.meddollina.assistant.service.orchestration;

import com.meddollina.assistant.model.Intent;
import com.meddollina.assistant.model.IntentResult;
import com.meddollina.assistant.model.Urgency;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationParametersTest {

    @Test
    void quickAnswersAreShortAndCold() {
        assertThat(GenerationParameters.forIntent(IntentResult.of(Intent.QUICK_ANSWER, Urgency.HIGH)))
                .isEqualTo(new GenerationParameters(800, 0.1));
    }

    @Test
    void emergencyWinsOverEverythingButQuickAnswers() {
        assertThat(GenerationParameters.forIntent(IntentResult.of(Intent.EMERGENCY, Urgency.HIGH)))
                .isEqualTo(new GenerationParameters(1000, 0.2));
    }

    @Test
    void detailedPlansGetTheLargestBudget() {
        IntentResult plan = IntentResult.of(Intent.SPECIFIC_INFO, Urgency.LOW).withFocusArea("surgical_plan");

        assertThat(GenerationParameters.forIntent(plan)).isEqualTo(new GenerationParameters(1500, 0.2));
        assertThat(GenerationParameters.forIntent(plan.withFocusArea("medications")).maxTokens()).isEqualTo(1500);
    }

    @Test
    void specificInfoOutsidePlansFallsThroughToUrgency() {
        IntentResult recovery = IntentResult.of(Intent.SPECIFIC_INFO, Urgency.HIGH).withFocusArea("recovery");

        assertThat(GenerationParameters.forIntent(recovery)).isEqualTo(new GenerationParameters(1000, 0.2));
    }

    @Test
    void followUpsAndDefaults() {
        assertThat(GenerationParameters.forIntent(IntentResult.of(Intent.FOLLOW_UP, Urgency.HIGH)))
                .isEqualTo(new GenerationParameters(1200, 0.2));
        assertThat(GenerationParameters.forIntent(IntentResult.of(Intent.MEDICAL, Urgency.MEDIUM)))
                .isEqualTo(new GenerationParameters(1200, 0.3));
        assertThat(GenerationParameters.forIntent(IntentResult.unparseable()))
                .isEqualTo(new GenerationParameters(1200, 0.3));
    }
}
