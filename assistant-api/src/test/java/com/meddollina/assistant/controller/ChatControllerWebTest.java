package com.meddollina.assistant.controller;

import com.meddollina.assistant.model.AnswerOutcome;
import com.meddollina.assistant.model.AnswerResult;
import com.meddollina.assistant.security.SecurityConfig;
import com.meddollina.assistant.service.QuestionAnsweringService;
import com.meddollina.assistant.service.SuggestionService;
import com.meddollina.assistant.service.memory.ConversationMemoryStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = ChatController.class)
@Import(SecurityConfig.class)
class ChatControllerWebTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private QuestionAnsweringService questionAnsweringService;

    @MockBean
    private SuggestionService suggestionService;

    @MockBean
    private ConversationMemoryStore memoryStore;

    @Test
    void answerIsSerializedWithSnakeCaseFields() {
        when(questionAnsweringService.answer(any(), any())).thenReturn(new AnswerResult(
                "Diabetes is a chronic condition.",
                List.of("ref.pdf (Page: 4)"),
                "Understanding Diabetes",
                Map.of("intent", "medical", "tokens_used", 120L, "processing_time", 1.25),
                AnswerOutcome.ANSWERED));

        webTestClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"message\": \"What is diabetes?\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.data.response").isEqualTo("Diabetes is a chronic condition.")
                .jsonPath("$.data.sources[0]").isEqualTo("ref.pdf (Page: 4)")
                .jsonPath("$.data.tokens_used").isEqualTo(120)
                .jsonPath("$.data.processing_time").isEqualTo(1.25)
                .jsonPath("$.message").doesNotExist();
    }

    @Test
    void generationFailureIsA503() {
        when(questionAnsweringService.answer(any(), any())).thenReturn(new AnswerResult(
                "The assistant is temporarily unable to answer.", List.of(), "heading",
                Map.of("intent", "error"), AnswerOutcome.GENERATION_FAILED));

        webTestClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"message\": \"What is diabetes?\"}")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.data.intent").isEqualTo("error");
    }

    @Test
    void blankMessageIsRejectedBeforeThePipeline() {
        webTestClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"message\": \"  \"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.message").value(message -> assertThat((String) message).startsWith("message:"));

        verifyNoInteractions(questionAnsweringService);
    }

    @Test
    void nullHistoryEntryIsABadRequest() {
        webTestClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"message\": \"What is diabetes?\", \"history\": [{\"role\": \"user\", \"content\": \"Hi\"}, null]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false);

        verifyNoInteractions(questionAnsweringService);
    }

    @Test
    void malformedBodyIsABadRequest() {
        webTestClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"message\": ")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Malformed request body");
    }

    @Test
    void suggestionsDefaultToFive() {
        when(suggestionService.suggest(5)).thenReturn(List.of("What is a stent?"));

        webTestClient.get()
                .uri("/api/suggestions")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data[0]").isEqualTo("What is a stent?");
    }
}
