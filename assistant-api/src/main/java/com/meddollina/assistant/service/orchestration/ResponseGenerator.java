package com.meddollina.assistant.service.orchestration;

import com.meddollina.assistant.model.GenerationRequest;
import com.meddollina.assistant.model.IntentResult;
import com.meddollina.assistant.model.RequestPurpose;
import com.meddollina.assistant.service.memory.ConversationContext;
import com.meddollina.assistant.service.metrics.OperationRecord;
import com.meddollina.assistant.service.metrics.PerformanceRecorder;
import com.meddollina.assistant.service.retrieval.RetrievalResult;
import com.meddollina.assistant.service.retry.RetriesExhaustedException;
import com.meddollina.assistant.service.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Two-stage generation: a reasoning pass whose notes feed the final answer pass.
 * The reasoning pass is best effort; the final pass either produces an answer or
 * throws {@link GenerationFailedException}.
 */
@Component
public class ResponseGenerator {

    private static final Logger log = LoggerFactory.getLogger(ResponseGenerator.class);

    private final ChatCompletionClient chatClient;
    private final PromptFactory promptFactory;
    private final TokenBudgetGuard budgetGuard;
    private final TokenCounter tokenCounter;
    private final ResponseCleaner cleaner;
    private final RetryExecutor retryExecutor;
    private final PerformanceRecorder recorder;
    private final int reasoningMaxTokens;
    private final int reasoningAttempts;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final double topP;

    public ResponseGenerator(ChatCompletionClient chatClient,
                             PromptFactory promptFactory,
                             TokenBudgetGuard budgetGuard,
                             TokenCounter tokenCounter,
                             ResponseCleaner cleaner,
                             RetryExecutor retryExecutor,
                             PerformanceRecorder recorder,
                             @Value("${assistant.generation.reasoning-max-tokens:2000}") int reasoningMaxTokens,
                             @Value("${assistant.generation.reasoning-attempts:1}") int reasoningAttempts,
                             @Value("${assistant.generation.max-attempts:5}") int maxAttempts,
                             @Value("${assistant.generation.base-delay-ms:2000}") long baseDelayMillis,
                             @Value("${assistant.generation.top-p:0.9}") double topP) {
        this.chatClient = chatClient;
        this.promptFactory = promptFactory;
        this.budgetGuard = budgetGuard;
        this.tokenCounter = tokenCounter;
        this.cleaner = cleaner;
        this.retryExecutor = retryExecutor;
        this.recorder = recorder;
        this.reasoningMaxTokens = reasoningMaxTokens;
        this.reasoningAttempts = Math.max(1, reasoningAttempts);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = Duration.ofMillis(baseDelayMillis);
        this.topP = topP;
    }

    /**
     * @return the reasoning notes, or an empty string when the pass failed
     */
    public String generateReasoning(String question, String historyText, RetrievalResult retrieval) {
        GenerationRequest request = GenerationRequest.of(
                RequestPurpose.REASONING,
                promptFactory.reasoning(historyText, retrieval.contextText(), question),
                reasoningMaxTokens);
        long started = System.nanoTime();
        long memoryBefore = recorder.resources().usedMemoryBytes();
        String reasoning;
        try {
            reasoning = retryExecutor.execute(() -> chatClient.complete(request), reasoningAttempts, baseDelay);
        } catch (RetriesExhaustedException ex) {
            log.warn("Reasoning pass failed, answering without it: {}", ex.getMessage());
            return "";
        }
        reasoning = reasoning == null ? "" : reasoning.strip();

        OperationRecord record = OperationRecord.of(
                        OperationRecord.REASONING,
                        tokenCounter.count(request.messages()) + tokenCounter.count(reasoning),
                        Duration.ofNanos(System.nanoTime() - started))
                .withMemoryDeltaBytes(recorder.resources().usedMemoryBytes() - memoryBefore);
        recorder.record(recorder.assessQuality(question, retrieval.contextText(), reasoning)
                .map(record::withQuality)
                .orElse(record));
        return reasoning;
    }

    public GeneratedAnswer generateAnswer(String question,
                                          String historyText,
                                          RetrievalResult retrieval,
                                          IntentResult intent,
                                          String reasoning,
                                          ConversationContext memory) {
        boolean filteredReasoning = reasoning != null && reasoning.contains(PromptFactory.QUESTION_TYPE_MARKER);
        GenerationParameters parameters = GenerationParameters.forIntent(intent);
        TokenBudgetGuard.GuardedPrompt prompt = budgetGuard.enforce(
                new TokenBudgetGuard.PromptInputs(retrieval.contextText(), historyText, reasoning),
                inputs -> promptFactory.answer(inputs.history(), inputs.context(), question, intent,
                        inputs.reasoning(), filteredReasoning));

        GenerationRequest request = GenerationRequest.of(RequestPurpose.ANSWER, prompt.messages(), parameters.maxTokens())
                .withSampling(parameters.temperature(), topP);
        long started = System.nanoTime();
        long memoryBefore = recorder.resources().usedMemoryBytes();

        String raw;
        try {
            raw = retryExecutor.execute(() -> chatClient.complete(request), maxAttempts, baseDelay);
        } catch (RetriesExhaustedException ex) {
            log.error("Answer generation failed after {} attempts", ex.attempts(), ex.getCause());
            recorder.recordError(OperationRecord.GENERATION);
            throw new GenerationFailedException(ex.attempts(), ex.getCause());
        }

        String answer = cleaner.clean(raw);
        int outputTokens = tokenCounter.count(raw);
        memory.memory().ifPresent(conversation -> conversation.saveTurn(question, answer));

        OperationRecord record = OperationRecord.of(
                        OperationRecord.GENERATION,
                        (long) prompt.inputTokens() + outputTokens,
                        Duration.ofNanos(System.nanoTime() - started))
                .withMemoryDeltaBytes(recorder.resources().usedMemoryBytes() - memoryBefore)
                .withIntent(intent.intent().wireName());
        recorder.record(recorder.assessQuality(question, retrieval.contextText(), answer)
                .map(record::withQuality)
                .orElse(record));

        return new GeneratedAnswer(answer, prompt.inputTokens(), outputTokens, parameters, prompt.truncated());
    }
}
