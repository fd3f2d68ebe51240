package com.meddollina.assistant.service.orchestration.openai;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.meddollina.assistant.model.ChatTurn;
import com.meddollina.assistant.model.GenerationRequest;
import com.meddollina.assistant.service.orchestration.ChatCompletionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Component
public class OpenAiChatClient implements ChatCompletionClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final WebClient webClient;
    private final String model;
    private final Duration timeout;

    public OpenAiChatClient(@Qualifier("llmWebClient") WebClient webClient,
                            @Value("${assistant.llm.model:meta-llama/Llama-3.3-70B-Instruct}") String model,
                            @Value("${assistant.llm.timeout-seconds:60}") long timeoutSeconds) {
        this.webClient = webClient;
        this.model = Objects.requireNonNullElse(model, "meta-llama/Llama-3.3-70B-Instruct");
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public String complete(GenerationRequest request) {
        Map<String, Object> payload = buildPayload(request);
        ChatCompletionResponse response;
        try {
            response = webClient.post()
                    .uri("/v1/chat/completions")
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(ChatCompletionResponse.class)
                    .timeout(timeout)
                    .onErrorResume(WebClientResponseException.class, this::logAndWrap)
                    .block(timeout.plusSeconds(1));
        } catch (ChatCompletionException ex) {
            throw ex;
        } catch (Exception ex) {
            log.warn("Chat completion for {} failed: {}", request.purpose(), ex.getMessage());
            throw new ChatCompletionException("Failed to invoke chat completion", ex);
        }

        Choice choice = response == null ? null : response.firstChoice();
        if (choice == null || choice.message() == null || choice.message().content() == null) {
            throw new ChatCompletionException("Chat completion returned no choices");
        }
        return choice.message().content();
    }

    Map<String, Object> buildPayload(GenerationRequest request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", model);
        payload.put("messages", toMessages(request.messages()));
        payload.put("stream", Boolean.FALSE);
        payload.put("max_tokens", request.maxTokens());
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.topP() != null) {
            payload.put("top_p", request.topP());
        }
        if (request.seed() != null) {
            payload.put("seed", request.seed());
        }
        if (request.structured()) {
            payload.put("response_format", request.responseFormat());
        }
        return payload;
    }

    private List<Message> toMessages(List<ChatTurn> turns) {
        return turns.stream()
                .map(turn -> new Message(turn.role().wireName(), turn.content() == null ? "" : turn.content()))
                .toList();
    }

    private Mono<ChatCompletionResponse> logAndWrap(WebClientResponseException exception) {
        HttpStatusCode status = exception.getStatusCode();
        log.warn("Chat completion returned {}: {}", status, exception.getResponseBodyAsString());
        return Mono.error(new ChatCompletionException("Chat completion returned " + status.value(), status.value(), exception));
    }

    public record Message(String role, String content) {
    }

    public record ChatCompletionResponse(List<Choice> choices, Usage usage) {

        public Choice firstChoice() {
            return choices == null || choices.isEmpty() ? null : choices.get(0);
        }
    }

    public record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
    }

    public record Usage(@JsonProperty("total_tokens") int totalTokens,
                        @JsonProperty("prompt_tokens") int promptTokens,
                        @JsonProperty("completion_tokens") int completionTokens) {
    }
}
