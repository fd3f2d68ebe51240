package com.meddollina.assistant.service.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
public class WebClientEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientEmbeddingsClient.class);

    private final WebClient embeddingsWebClient;

    public WebClientEmbeddingsClient(@Qualifier("embeddingsWebClient") WebClient embeddingsWebClient) {
        this.embeddingsWebClient = embeddingsWebClient;
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("No text provided for embedding");
        }
        try {
            EmbedResponse response = embeddingsWebClient.post()
                    .uri("/embed")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new EmbedRequest(text))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .onErrorResume(throwable -> {
                        log.warn("Embeddings service call failed: {}", throwable.getMessage());
                        return Mono.error(new EmbeddingException("Failed to compute embedding", throwable));
                    })
                    .block();
            if (response == null || response.vector() == null || response.vector().isEmpty()) {
                throw new EmbeddingException("Embeddings service returned no vector");
            }
            return response.vector();
        } catch (EmbeddingException ex) {
            throw ex;
        } catch (Exception e) {
            throw new EmbeddingException("Failed to compute embedding", e);
        }
    }

    private record EmbedRequest(String text) {}

    private record EmbedResponse(List<Double> vector) {}
}
