package com.meddollina.assistant.controller;

import com.meddollina.assistant.model.AnswerOutcome;
import com.meddollina.assistant.model.AnswerResult;
import com.meddollina.assistant.model.ChatRequest;
import com.meddollina.assistant.model.ChatTurn;
import com.meddollina.assistant.model.Question;
import com.meddollina.assistant.service.QuestionAnsweringService;
import com.meddollina.assistant.service.SuggestionService;
import com.meddollina.assistant.service.memory.ConversationContext;
import com.meddollina.assistant.service.memory.ConversationMemoryStore;
import com.meddollina.assistant.service.memory.InMemoryConversationMemory;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ChatControllerTest {

    private final QuestionAnsweringService questionAnsweringService = mock(QuestionAnsweringService.class);
    private final SuggestionService suggestionService = mock(SuggestionService.class);
    private final ConversationMemoryStore memoryStore = mock(ConversationMemoryStore.class);
    private final ChatController controller = new ChatController(questionAnsweringService, suggestionService, memoryStore);

    @Test
    void answeredQuestionIsASuccessfulResponse() {
        when(questionAnsweringService.answer(any(), any())).thenReturn(new AnswerResult(
                "Diabetes is a chronic condition.",
                List.of("ref.pdf (Page: 4)"),
                "Understanding Diabetes",
                Map.of("intent", "medical", "tokens_used", 120L, "processing_time", 1.25),
                AnswerOutcome.ANSWERED));

        StepVerifier.create(controller.chat(new ChatRequest("What is diabetes?", null, null)))
                .assertNext(entity -> {
                    assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(entity.getBody().success()).isTrue();
                    assertThat(entity.getBody().data().response()).isEqualTo("Diabetes is a chronic condition.");
                    assertThat(entity.getBody().data().sources()).containsExactly("ref.pdf (Page: 4)");
                    assertThat(entity.getBody().data().tokensUsed()).isEqualTo(120L);
                    assertThat(entity.getBody().data().processingTime()).isEqualTo(1.25);
                })
                .verifyComplete();

        ArgumentCaptor<Question> question = ArgumentCaptor.forClass(Question.class);
        verify(questionAnsweringService).answer(question.capture(), any());
        assertThat(question.getValue().text()).isEqualTo("What is diabetes?");
    }

    @Test
    void exhaustedGenerationMapsToServiceUnavailable() {
        when(questionAnsweringService.answer(any(), any())).thenReturn(new AnswerResult(
                "The assistant is temporarily unable to answer.", List.of(), "What is diabetes?...",
                Map.of("intent", "error", "urgency", "low"), AnswerOutcome.GENERATION_FAILED));

        StepVerifier.create(controller.chat(new ChatRequest("What is diabetes?", null, null)))
                .assertNext(entity -> {
                    assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                    assertThat(entity.getBody().success()).isFalse();
                    assertThat(entity.getBody().message()).isEqualTo("The assistant is temporarily unable to answer.");
                    assertThat(entity.getBody().data().intent()).isEqualTo("error");
                })
                .verifyComplete();
    }

    @Test
    void validationErrorIsAnUnsuccessfulOk() {
        when(questionAnsweringService.answer(any(), any())).thenReturn(new AnswerResult(
                "Validation error: timeout", List.of(), "Tell me a joke...",
                Map.of("intent", "validation_error", "urgency", "low"), AnswerOutcome.VALIDATION_ERROR));

        StepVerifier.create(controller.chat(new ChatRequest("Tell me a joke", null, null)))
                .assertNext(entity -> {
                    assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(entity.getBody().success()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void rejectionIsStillASuccessfulResponse() {
        when(questionAnsweringService.answer(any(), any())).thenReturn(new AnswerResult(
                "Goodbye!", List.of(), "bye...", Map.of("intent", "validation_failed"), AnswerOutcome.REJECTED));

        StepVerifier.create(controller.chat(new ChatRequest("bye", null, null)))
                .assertNext(entity -> assertThat(entity.getBody().success()).isTrue())
                .verifyComplete();
    }

    @Test
    void suppliedHistoryIsPassedAsReadOnlyContext() {
        stubAnswered();
        List<ChatTurn> history = List.of(ChatTurn.user("What is a hernia?"), ChatTurn.assistant("A bulge."));

        StepVerifier.create(controller.chat(new ChatRequest("How is it repaired?", "conv-1", history)))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<ConversationContext> context = ArgumentCaptor.forClass(ConversationContext.class);
        verify(questionAnsweringService).answer(any(), context.capture());
        assertThat(context.getValue().isStructured()).isFalse();
        assertThat(context.getValue().messages("How is it repaired?")).containsExactlyElementsOf(history);
        verifyNoInteractions(memoryStore);
    }

    @Test
    void conversationIdSelectsStoredMemory() {
        stubAnswered();
        InMemoryConversationMemory memory = new InMemoryConversationMemory();
        when(memoryStore.forConversation("conv-1")).thenReturn(memory);

        StepVerifier.create(controller.chat(new ChatRequest("What is a hernia?", "conv-1", null)))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<ConversationContext> context = ArgumentCaptor.forClass(ConversationContext.class);
        verify(questionAnsweringService).answer(any(), context.capture());
        assertThat(context.getValue().memory()).containsSame(memory);
    }

    @Test
    void suggestionsAreWrappedInAnEnvelope() {
        when(suggestionService.suggest(3)).thenReturn(List.of("What is a stent?"));

        StepVerifier.create(controller.suggestions(3))
                .assertNext(response -> {
                    assertThat(response.success()).isTrue();
                    assertThat(response.data()).containsExactly("What is a stent?");
                })
                .verifyComplete();
    }

    private void stubAnswered() {
        when(questionAnsweringService.answer(any(), any())).thenReturn(new AnswerResult(
                "ok", List.of(), "heading", Map.of("intent", "medical"), AnswerOutcome.ANSWERED));
    }
}
