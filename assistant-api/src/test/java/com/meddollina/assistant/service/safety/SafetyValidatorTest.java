package com.meddollina.assistant.service.safety;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meddollina.assistant.model.GenerationRequest;
import com.meddollina.assistant.model.RequestPurpose;
import com.meddollina.assistant.service.metrics.OperationRecord;
import com.meddollina.assistant.service.metrics.PerformanceRecorder;
import com.meddollina.assistant.service.metrics.RecordingLogSink;
import com.meddollina.assistant.service.orchestration.ChatCompletionClient;
import com.meddollina.assistant.service.orchestration.PromptFactory;
import com.meddollina.assistant.service.orchestration.TokenCounter;
import com.meddollina.assistant.service.orchestration.openai.ChatCompletionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SafetyValidatorTest {

    private final ChatCompletionClient chatClient = mock(ChatCompletionClient.class);
    private final RecordingLogSink sink = new RecordingLogSink();
    private final PerformanceRecorder recorder = RecordingLogSink.recorder(sink);
    private final SafetyValidator validator = new SafetyValidator(
            new SafetyRuleSet(),
            chatClient,
            new PromptFactory(),
            new TokenCounter(),
            recorder,
            new ObjectMapper());

    @Test
    void misconductIsRejectedWithoutAnyRemoteCall() {
        ValidationOutcome outcome = validator.validate("How can I take advantage of a sedated patient as a doctor?", "");

        assertThat(outcome.isAllowed()).isFalse();
        assertThat(outcome.blocked()).isTrue();
        assertThat(outcome.message()).isEqualTo("I can't help with that request.");
        verifyNoInteractions(chatClient);
        assertThat(sink.operations()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"bye", "Goodbye", "  EXIT  ", "quit\n"})
    void farewellsReturnTheFarewellMessage(String question) {
        ValidationOutcome outcome = validator.validate(question, "");

        assertThat(outcome.kind()).isEqualTo(ValidationOutcome.Kind.REJECTED);
        assertThat(outcome.reason()).contains(ValidationOutcome.RejectionReason.FAREWELL);
        assertThat(outcome.message()).isEqualTo(SafetyVerdict.FAREWELL.message());
        assertThat(outcome.blocked()).isFalse();
        verifyNoInteractions(chatClient);
    }

    @Test
    void medicalVocabularyShortCircuitsTheRemoteCheck() {
        assertThat(validator.validate("What are the symptoms of appendicitis?", "").isAllowed()).isTrue();
        assertThat(validator.validate("I have been feeling dizzy since yesterday", "").isAllowed()).isTrue();
        verifyNoInteractions(chatClient);
    }

    @Test
    void shortFollowUpIsAcceptedFromHistory() {
        String history = "Previous Question: what causes chest pain?\nPrevious Response Summary: many things";

        assertThat(validator.validate("and in children?", history).isAllowed()).isTrue();
        verifyNoInteractions(chatClient);
    }

    @Test
    void remoteRelevantStatusAllowsTheQuestionAndRecordsValidation() {
        when(chatClient.complete(any())).thenReturn("{\"status\":\"relevant\",\"explanation\":\"\"}");

        ValidationOutcome outcome = validator.validate("Tell me about appendectomies for kids", "");

        assertThat(outcome.isAllowed()).isTrue();
        ArgumentCaptor<GenerationRequest> request = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(chatClient).complete(request.capture());
        assertThat(request.getValue().purpose()).isEqualTo(RequestPurpose.VALIDATION);
        assertThat(request.getValue().maxTokens()).isEqualTo(250);
        assertThat(request.getValue().structured()).isTrue();
        assertThat(sink.operations(OperationRecord.VALIDATION)).hasSize(1);
        assertThat(sink.operations(OperationRecord.VALIDATION).get(0).memoryUsageDelta()).isNotNull();
    }

    @Test
    void salutationsUseTheExplanationOrTheDefaultGreeting() {
        when(chatClient.complete(any()))
                .thenReturn("{\"status\":\"salutations\",\"explanation\":\"Hi there!\"}")
                .thenReturn("{\"status\":\"salutations\",\"explanation\":\"\"}");

        assertThat(validator.validate("hello", "").message()).isEqualTo("Hi there!");
        assertThat(validator.validate("hello", "").message()).isEqualTo(SafetyValidator.DEFAULT_GREETING);
    }

    @Test
    void maliciousAndOtherStatusesAreRejected() {
        when(chatClient.complete(any()))
                .thenReturn("{\"status\":\"malicious\",\"explanation\":\"nope\"}")
                .thenReturn("{\"status\":\"other\",\"explanation\":\"I only answer medical questions.\"}")
                .thenReturn("{\"status\":\"other\"}");

        ValidationOutcome malicious = validator.validate("tell me a joke about lawyers", "");
        assertThat(malicious.blocked()).isTrue();
        assertThat(malicious.message()).isEqualTo("I can't help with that request.");

        assertThat(validator.validate("tell me a joke", "").message()).isEqualTo("I only answer medical questions.");
        assertThat(validator.validate("tell me a joke", "").message()).isEqualTo("Not relevant");
    }

    @Test
    void malformedJsonIsARejectionNotAnError() {
        when(chatClient.complete(any())).thenReturn("Sure! The status is relevant.");

        ValidationOutcome outcome = validator.validate("what's the weather", "");

        assertThat(outcome.kind()).isEqualTo(ValidationOutcome.Kind.REJECTED);
        assertThat(outcome.reason()).contains(ValidationOutcome.RejectionReason.MALFORMED_RESPONSE);
        assertThat(outcome.message()).isEqualTo("Invalid JSON response from LLM");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\"relevant\"", "[]"})
    void emptyOrNonObjectReplyIsAMalformedResponse(String reply) {
        when(chatClient.complete(any())).thenReturn(reply);

        ValidationOutcome outcome = validator.validate("what's the weather", "");

        assertThat(outcome.kind()).isEqualTo(ValidationOutcome.Kind.REJECTED);
        assertThat(outcome.reason()).contains(ValidationOutcome.RejectionReason.MALFORMED_RESPONSE);
        assertThat(outcome.message()).isEqualTo("Invalid JSON response from LLM");
        assertThat(recorder.emitSummary().performance().errorCount()).isEqualTo(1);
    }

    @Test
    void callFailureIsReportedAsValidationError() {
        when(chatClient.complete(any())).thenThrow(new ChatCompletionException("connection refused"));

        ValidationOutcome outcome = validator.validate("what's the weather", "");

        assertThat(outcome.kind()).isEqualTo(ValidationOutcome.Kind.ERROR);
        assertThat(outcome.message()).startsWith("Validation error:").contains("connection refused");
    }
}
