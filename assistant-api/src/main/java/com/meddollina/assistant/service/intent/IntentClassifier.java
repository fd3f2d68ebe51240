package com.meddollina.assistant.service.intent;

import com.meddollina.assistant.model.GenerationRequest;
import com.meddollina.assistant.model.Intent;
import com.meddollina.assistant.model.IntentResult;
import com.meddollina.assistant.model.RequestPurpose;
import com.meddollina.assistant.service.orchestration.ChatCompletionClient;
import com.meddollina.assistant.service.orchestration.PromptFactory;
import com.meddollina.assistant.service.retry.RetriesExhaustedException;
import com.meddollina.assistant.service.retry.RetryExecutor;
import com.meddollina.assistant.service.safety.MedicalVocabulary;
import com.meddollina.assistant.service.safety.SafetyRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Classifies a question for response shaping. Never throws: abuse is caught locally,
 * an unreachable classifier yields {@link IntentResult#unavailable()} and an unreadable
 * reply yields {@link IntentResult#unparseable()}.
 */
@Component
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    static final int MAX_TOKENS = 250;
    static final double TEMPERATURE = 0.1;
    static final double TOP_P = 0.9;
    static final List<String> PLAN_PHRASES = List.of(
            "treatment plan", "surgical plan", "complete plan", "entire plan", "dosage", "medication");

    private final SafetyRuleSet ruleSet;
    private final ChatCompletionClient chatClient;
    private final PromptFactory promptFactory;
    private final IntentResponseParser parser;
    private final RetryExecutor retryExecutor;
    private final int maxAttempts;
    private final Duration baseDelay;

    public IntentClassifier(SafetyRuleSet ruleSet,
                            ChatCompletionClient chatClient,
                            PromptFactory promptFactory,
                            IntentResponseParser parser,
                            RetryExecutor retryExecutor,
                            @Value("${assistant.intent.max-attempts:3}") int maxAttempts,
                            @Value("${assistant.intent.base-delay-ms:1000}") long baseDelayMillis) {
        this.ruleSet = ruleSet;
        this.chatClient = chatClient;
        this.promptFactory = promptFactory;
        this.parser = parser;
        this.retryExecutor = retryExecutor;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = Duration.ofMillis(baseDelayMillis);
    }

    public IntentResult classify(String question, String historyText) {
        if (ruleSet.detectAbuse(question).isPresent()) {
            log.debug("Abusive phrasing detected, skipping intent call");
            return IntentResult.malicious();
        }

        GenerationRequest request = GenerationRequest.of(
                        RequestPurpose.INTENT_DETECTION,
                        promptFactory.intentDetection(historyText, question),
                        MAX_TOKENS)
                .withSampling(TEMPERATURE, TOP_P)
                .withJsonResponse();

        String raw;
        try {
            raw = retryExecutor.execute(() -> chatClient.complete(request), maxAttempts, baseDelay);
        } catch (RetriesExhaustedException ex) {
            log.warn("Intent detection unavailable after {} attempts, using default intent", ex.attempts());
            return IntentResult.unavailable();
        }

        IntentResult parsed = parser.parse(raw).orElse(null);
        if (parsed == null) {
            return IntentResult.unparseable();
        }
        IntentResult result = refine(parsed, question, historyText);
        log.debug("Detected intent {} (urgency {}, focus {})",
                result.intent().wireName(), result.urgency().wireName(), result.focusArea().orElse("-"));
        return result;
    }

    IntentResult refine(IntentResult result, String question, String historyText) {
        IntentResult refined = result;
        if (refined.mainCondition().isEmpty() && historyText != null && !historyText.isBlank()) {
            String condition = MedicalVocabulary.firstCondition(historyText).orElse(null);
            if (condition != null) {
                refined = refined.withMainCondition(condition);
            }
        }

        String questionLower = question.toLowerCase(Locale.ROOT);
        if (PLAN_PHRASES.stream().anyMatch(questionLower::contains)) {
            String focus;
            if (questionLower.contains("surgical") || questionLower.contains("surgery")) {
                focus = "surgical_plan";
            } else if (questionLower.contains("medication") || questionLower.contains("dosage")) {
                focus = "medications";
            } else {
                focus = "treatment";
            }
            refined = refined.withIntent(Intent.SPECIFIC_INFO).withFocusArea(focus);
        }
        return refined;
    }
}
