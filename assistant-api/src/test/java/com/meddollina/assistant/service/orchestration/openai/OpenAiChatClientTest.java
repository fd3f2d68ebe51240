package com.meddollina.assistant.service.orchestration.openai;

import com.meddollina.assistant.model.ChatTurn;
import com.meddollina.assistant.model.GenerationRequest;
import com.meddollina.assistant.model.RequestPurpose;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiChatClientTest {

    private static final List<ChatTurn> MESSAGES = List.of(ChatTurn.system("persona"), ChatTurn.user("What is diabetes?"));

    @Test
    void payloadCarriesOnlyTheSetSamplingFields() {
        OpenAiChatClient client = new OpenAiChatClient(WebClient.create(), "test-model", 5);

        Map<String, Object> payload = client.buildPayload(GenerationRequest.of(RequestPurpose.HEADING, MESSAGES, 12));

        assertThat(payload)
                .containsEntry("model", "test-model")
                .containsEntry("stream", false)
                .containsEntry("max_tokens", 12)
                .doesNotContainKeys("temperature", "top_p", "seed", "response_format");
        assertThat(payload.get("messages")).asList().containsExactly(
                new OpenAiChatClient.Message("system", "persona"),
                new OpenAiChatClient.Message("user", "What is diabetes?"));
    }

    @Test
    void structuredRequestsAskForAJsonObject() {
        OpenAiChatClient client = new OpenAiChatClient(WebClient.create(), "test-model", 5);
        GenerationRequest request = GenerationRequest.of(RequestPurpose.INTENT_DETECTION, MESSAGES, 250)
                .withSampling(0.1, 0.9)
                .withSeed(3)
                .withJsonResponse();

        assertThat(client.buildPayload(request))
                .containsEntry("temperature", 0.1)
                .containsEntry("top_p", 0.9)
                .containsEntry("seed", 3)
                .containsEntry("response_format", Map.of("type", "json_object"));
    }

    @Test
    void returnsTheFirstChoiceContent() {
        WebClient webClient = respondingWith(HttpStatus.OK, """
                {"choices": [{"message": {"role": "assistant", "content": "Diabetes is a chronic condition."},
                              "finish_reason": "stop"}],
                 "usage": {"total_tokens": 30, "prompt_tokens": 20, "completion_tokens": 10}}
                """);
        OpenAiChatClient client = new OpenAiChatClient(webClient, "test-model", 5);

        assertThat(client.complete(GenerationRequest.of(RequestPurpose.ANSWER, MESSAGES, 100)))
                .isEqualTo("Diabetes is a chronic condition.");
    }

    @Test
    void emptyChoicesAreAFailure() {
        OpenAiChatClient client = new OpenAiChatClient(respondingWith(HttpStatus.OK, "{\"choices\": []}"), "test-model", 5);

        assertThatThrownBy(() -> client.complete(GenerationRequest.of(RequestPurpose.ANSWER, MESSAGES, 100)))
                .isInstanceOf(ChatCompletionException.class)
                .hasMessageContaining("no choices");
    }

    @Test
    void errorStatusIsCarriedOnTheException() {
        OpenAiChatClient client = new OpenAiChatClient(
                respondingWith(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"slow down\"}"), "test-model", 5);

        assertThatThrownBy(() -> client.complete(GenerationRequest.of(RequestPurpose.ANSWER, MESSAGES, 100)))
                .isInstanceOfSatisfying(ChatCompletionException.class, ex -> {
                    assertThat(ex.status()).isEqualTo(429);
                    assertThat(ex.rateLimited()).isTrue();
                });
    }

    private static WebClient respondingWith(HttpStatus status, String body) {
        return WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()))
                .build();
    }
}
