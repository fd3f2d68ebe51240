package com.meddollina.assistant.service.safety;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meddollina.assistant.model.ChatTurn;
import com.meddollina.assistant.model.GenerationRequest;
import com.meddollina.assistant.model.RequestPurpose;
import com.meddollina.assistant.service.metrics.OperationRecord;
import com.meddollina.assistant.service.metrics.PerformanceRecorder;
import com.meddollina.assistant.service.orchestration.ChatCompletionClient;
import com.meddollina.assistant.service.orchestration.PromptFactory;
import com.meddollina.assistant.service.orchestration.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Relevance and safety gate. Local rules and the medical vocabulary are checked first;
 * the screening call to the model is only made when none of them decides.
 */
@Component
public class SafetyValidator {

    private static final Logger log = LoggerFactory.getLogger(SafetyValidator.class);

    static final int MAX_TOKENS = 250;
    static final String DEFAULT_GREETING = "Hello! I'm Meddollina, your surgical assistant. How can I help you today?";
    static final String MALICIOUS_MESSAGE = "I can't help with that request.";
    static final String NOT_RELEVANT = "Not relevant";
    static final String INVALID_JSON = "Invalid JSON response from LLM";

    private final SafetyRuleSet ruleSet;
    private final ChatCompletionClient chatClient;
    private final PromptFactory promptFactory;
    private final TokenCounter tokenCounter;
    private final PerformanceRecorder recorder;
    private final ObjectMapper objectMapper;

    public SafetyValidator(SafetyRuleSet ruleSet,
                           ChatCompletionClient chatClient,
                           PromptFactory promptFactory,
                           TokenCounter tokenCounter,
                           PerformanceRecorder recorder,
                           ObjectMapper objectMapper) {
        this.ruleSet = ruleSet;
        this.chatClient = chatClient;
        this.promptFactory = promptFactory;
        this.tokenCounter = tokenCounter;
        this.recorder = recorder;
        this.objectMapper = objectMapper;
    }

    public ValidationOutcome validate(String question, String historyText) {
        Optional<SafetyRule> rule = ruleSet.evaluate(question);
        if (rule.isPresent()) {
            log.debug("Question rejected by rule {}", rule.get().name());
            return ValidationOutcome.fromVerdict(rule.get().verdict());
        }
        if (MedicalVocabulary.isLikelyMedical(question, historyText)) {
            return ValidationOutcome.allowed();
        }
        return screenRemotely(question, historyText);
    }

    private ValidationOutcome screenRemotely(String question, String historyText) {
        List<ChatTurn> messages = promptFactory.validation(historyText, question);
        GenerationRequest request = GenerationRequest.of(RequestPurpose.VALIDATION, messages, MAX_TOKENS)
                .withJsonResponse();
        long started = System.nanoTime();
        long memoryBefore = recorder.resources().usedMemoryBytes();

        String raw;
        try {
            raw = chatClient.complete(request);
        } catch (RuntimeException ex) {
            log.warn("Validation call failed: {}", ex.getMessage());
            recorder.recordError(OperationRecord.VALIDATION);
            return ValidationOutcome.error("Validation error: " + ex.getMessage());
        }

        JsonNode verdict = parseVerdict(raw);
        if (verdict == null) {
            recorder.recordError(OperationRecord.VALIDATION);
            return ValidationOutcome.rejected(ValidationOutcome.RejectionReason.MALFORMED_RESPONSE, INVALID_JSON);
        }

        long memoryAfter = recorder.resources().usedMemoryBytes();
        recorder.record(OperationRecord.of(
                        OperationRecord.VALIDATION,
                        tokenCounter.count(messages) + tokenCounter.count(raw),
                        Duration.ofNanos(System.nanoTime() - started))
                .withMemoryDeltaBytes(memoryAfter - memoryBefore));
        return interpret(verdict);
    }

    // empty input parses to a MissingNode rather than failing
    private JsonNode parseVerdict(String raw) {
        if (raw == null || raw.isBlank()) {
            log.warn("Validation response was empty");
            return null;
        }
        try {
            JsonNode verdict = objectMapper.readTree(raw);
            if (verdict == null || !verdict.isObject()) {
                log.warn("Validation response was not a JSON object");
                return null;
            }
            return verdict;
        } catch (JsonProcessingException ex) {
            log.warn("Validation response was not JSON: {}", ex.getOriginalMessage());
            return null;
        }
    }

    ValidationOutcome interpret(JsonNode verdict) {
        String status = verdict.path("status").asText("").trim().toLowerCase(Locale.ROOT);
        String explanation = verdict.path("explanation").asText("").trim();
        return switch (status) {
            case "relevant" -> ValidationOutcome.allowed();
            case "salutations" -> ValidationOutcome.rejected(ValidationOutcome.RejectionReason.SALUTATION,
                    explanation.isEmpty() ? DEFAULT_GREETING : explanation);
            case "malicious" -> ValidationOutcome.rejected(ValidationOutcome.RejectionReason.MALICIOUS, MALICIOUS_MESSAGE);
            default -> ValidationOutcome.rejected(ValidationOutcome.RejectionReason.NOT_RELEVANT,
                    explanation.isEmpty() ? NOT_RELEVANT : explanation);
        };
    }
}
