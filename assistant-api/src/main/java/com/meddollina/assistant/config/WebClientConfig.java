package com.meddollina.assistant.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * One client per remote dependency of the pipeline. Each gets its own response timeout,
 * the inference endpoint additionally carries the bearer token when one is configured.
 */
@Configuration
public class WebClientConfig {

    // vector store responses include full passage text
    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;

    @Bean
    public WebClient vectorStoreWebClient(@Value("${assistant.vector-store.base-url:http://localhost:8000}") String baseUrl,
                                          @Value("${assistant.vector-store.timeout-seconds:30}") long timeoutSeconds) {
        return jsonClient(baseUrl, timeoutSeconds).build();
    }

    @Bean
    public WebClient embeddingsWebClient(@Value("${assistant.embeddings.base-url:http://localhost:9000}") String baseUrl,
                                         @Value("${assistant.embeddings.timeout-seconds:30}") long timeoutSeconds) {
        return jsonClient(baseUrl, timeoutSeconds).build();
    }

    @Bean
    public WebClient llmWebClient(@Value("${assistant.llm.base-url:https://router.huggingface.co}") String baseUrl,
                                  @Value("${assistant.llm.api-key:}") String apiKey,
                                  @Value("${assistant.llm.timeout-seconds:60}") long timeoutSeconds) {
        WebClient.Builder builder = jsonClient(baseUrl, timeoutSeconds);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return builder.build();
    }

    private static WebClient.Builder jsonClient(String baseUrl, long timeoutSeconds) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                        .build());
        if (timeoutSeconds > 0) {
            builder.clientConnector(new ReactorClientHttpConnector(
                    HttpClient.create().responseTimeout(Duration.ofSeconds(timeoutSeconds))));
        }
        return builder;
    }
}
