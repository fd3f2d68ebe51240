package com.meddollina.assistant.service;

import com.meddollina.assistant.model.AnswerOutcome;
import com.meddollina.assistant.model.AnswerResult;
import com.meddollina.assistant.model.Intent;
import com.meddollina.assistant.model.IntentResult;
import com.meddollina.assistant.model.Question;
import com.meddollina.assistant.service.intent.ClarificationResponder;
import com.meddollina.assistant.service.intent.IntentClassifier;
import com.meddollina.assistant.service.memory.ConversationContext;
import com.meddollina.assistant.service.memory.ConversationHistoryFormatter;
import com.meddollina.assistant.service.metrics.PerformanceRecorder;
import com.meddollina.assistant.service.orchestration.GeneratedAnswer;
import com.meddollina.assistant.service.orchestration.GenerationFailedException;
import com.meddollina.assistant.service.orchestration.HeadingGenerator;
import com.meddollina.assistant.service.orchestration.ResponseGenerator;
import com.meddollina.assistant.service.pipeline.PipelineEvents;
import com.meddollina.assistant.service.pipeline.PipelineTracker;
import com.meddollina.assistant.service.retrieval.RetrievalCoordinator;
import com.meddollina.assistant.service.retrieval.RetrievalResult;
import com.meddollina.assistant.service.safety.SafetyValidator;
import com.meddollina.assistant.service.safety.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class DefaultQuestionAnsweringService implements QuestionAnsweringService {

    private static final Logger log = LoggerFactory.getLogger(DefaultQuestionAnsweringService.class);

    static final String REFUSAL = "I can't help with that request.";
    static final String GENERATION_ERROR = "The assistant is temporarily unable to answer. Please try again shortly.";
    private static final int LOGGED_QUESTION_CHARS = 80;

    private final SafetyValidator validator;
    private final IntentClassifier intentClassifier;
    private final ClarificationResponder clarificationResponder;
    private final ConversationHistoryFormatter historyFormatter;
    private final RetrievalCoordinator retrievalCoordinator;
    private final ResponseGenerator responseGenerator;
    private final HeadingGenerator headingGenerator;
    private final PerformanceRecorder recorder;
    private final PipelineTracker pipelineTracker;

    public DefaultQuestionAnsweringService(SafetyValidator validator,
                                           IntentClassifier intentClassifier,
                                           ClarificationResponder clarificationResponder,
                                           ConversationHistoryFormatter historyFormatter,
                                           RetrievalCoordinator retrievalCoordinator,
                                           ResponseGenerator responseGenerator,
                                           HeadingGenerator headingGenerator,
                                           PerformanceRecorder recorder,
                                           PipelineTracker pipelineTracker) {
        this.validator = validator;
        this.intentClassifier = intentClassifier;
        this.clarificationResponder = clarificationResponder;
        this.historyFormatter = historyFormatter;
        this.retrievalCoordinator = retrievalCoordinator;
        this.responseGenerator = responseGenerator;
        this.headingGenerator = headingGenerator;
        this.recorder = recorder;
        this.pipelineTracker = pipelineTracker;
    }

    @Override
    public AnswerResult answer(Question question, ConversationContext memory) {
        long started = System.nanoTime();
        String text = question.text();
        ConversationContext conversation = memory == null ? ConversationContext.none() : memory;
        try {
            return run(text, conversation, started);
        } catch (RuntimeException ex) {
            log.error("Pipeline failed unexpectedly", ex);
            recorder.recordProcessingTime(elapsed(started));
            return new AnswerResult(GENERATION_ERROR, List.of(), HeadingGenerator.fallback(text),
                    Map.of("intent", "error", "urgency", "low"), AnswerOutcome.GENERATION_FAILED);
        }
    }

    private AnswerResult run(String text, ConversationContext memory, long started) {
        recorder.startQuestion();
        PipelineTracker.Run pipeline = pipelineTracker.start();
        log.debug("Pipeline {} started for \"{}\"", pipeline.id(), abbreviate(text));
        String historyText = historyFormatter.format(memory, text);

        ValidationOutcome validation = validator.validate(text, historyText);
        if (validation.kind() == ValidationOutcome.Kind.ERROR) {
            pipeline.advance(PipelineEvents.VALIDATION_ERROR);
            return finish(started, new AnswerResult(validation.message(), List.of(), HeadingGenerator.fallback(text),
                    Map.of("intent", "validation_error", "urgency", "low"), AnswerOutcome.VALIDATION_ERROR));
        }
        if (!validation.isAllowed()) {
            pipeline.advance(PipelineEvents.VALIDATION_REJECTED);
            if (validation.blocked()) {
                return finish(started, new AnswerResult(validation.message(), List.of(), HeadingGenerator.fallback(text),
                        Map.of("intent", "malicious", "urgency", "blocked"), AnswerOutcome.BLOCKED));
            }
            return finish(started, new AnswerResult(validation.message(), List.of(), HeadingGenerator.fallback(text),
                    Map.of("intent", "validation_failed", "urgency", "low"), AnswerOutcome.REJECTED));
        }
        pipeline.advance(PipelineEvents.VALIDATION_PASSED);

        String heading = headingGenerator.generate(text);
        IntentResult intent = intentClassifier.classify(text, historyText);
        if (intent.intent() == Intent.MALICIOUS) {
            pipeline.advance(PipelineEvents.INTENT_MALICIOUS);
            return finish(started, new AnswerResult(REFUSAL, List.of(), heading,
                    Map.of("intent", "malicious", "urgency", "blocked"), AnswerOutcome.BLOCKED));
        }
        if (intent.intent() == Intent.CLARIFICATION_NEEDED) {
            pipeline.advance(PipelineEvents.INTENT_NEEDS_CLARIFICATION);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("intent", intent.intent().wireName());
            metadata.put("focus_area", intent.focusArea().orElse(""));
            metadata.put("urgency", intent.urgency().wireName());
            metadata.put("needs_clarification", intent.needsClarification().orElse(""));
            return finish(started, new AnswerResult(clarificationResponder.respond(intent), List.of(), heading,
                    metadata, AnswerOutcome.CLARIFICATION_NEEDED));
        }
        pipeline.advance(PipelineEvents.INTENT_RESOLVED);

        RetrievalResult retrieval = retrievalCoordinator.retrieve(text);
        pipeline.advance(PipelineEvents.DOCUMENTS_RETRIEVED);

        String reasoning = responseGenerator.generateReasoning(text, historyText, retrieval);
        pipeline.advance(PipelineEvents.REASONING_COMPLETED);

        GeneratedAnswer generated;
        try {
            generated = responseGenerator.generateAnswer(text, historyText, retrieval, intent, reasoning, memory);
        } catch (GenerationFailedException ex) {
            pipeline.advance(PipelineEvents.GENERATION_FAILED);
            return finish(started, new AnswerResult(GENERATION_ERROR, List.of(), heading,
                    Map.of("intent", "error", "urgency", "low"), AnswerOutcome.GENERATION_FAILED));
        }
        pipeline.advance(PipelineEvents.ANSWER_GENERATED);

        Duration processing = elapsed(started);
        Map<String, Object> metadata = new LinkedHashMap<>(intent.toMetadata());
        metadata.put("tokens_used", generated.tokensUsed());
        metadata.put("processing_time", Math.round(processing.toMillis() / 10.0) / 100.0);
        recorder.recordProcessingTime(processing);
        recorder.emitSummary();
        log.debug("Answered question with intent {} from {} sources", intent.intent().wireName(), retrieval.sourceLinks().size());
        return new AnswerResult(generated.text(), retrieval.sourceLinks(), heading, metadata, AnswerOutcome.ANSWERED);
    }

    private AnswerResult finish(long started, AnswerResult result) {
        recorder.recordProcessingTime(elapsed(started));
        log.debug("Question finished with outcome {}", result.outcome());
        return result;
    }

    private static String abbreviate(String text) {
        return text.length() <= LOGGED_QUESTION_CHARS ? text : text.substring(0, LOGGED_QUESTION_CHARS) + "...";
    }

    private static Duration elapsed(long started) {
        return Duration.ofNanos(System.nanoTime() - started);
    }
}
