package com.meddollina.assistant.service.retrieval;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.meddollina.assistant.model.RetrievedDocument;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;

@Component
public class HttpVectorStoreClient implements VectorStoreClient {

    private final WebClient vectorStoreWebClient;
    private final String collection;

    public HttpVectorStoreClient(@Qualifier("vectorStoreWebClient") WebClient vectorStoreWebClient,
                                 @Value("${assistant.vector-store.collection:medical_references}") String collection) {
        this.vectorStoreWebClient = vectorStoreWebClient;
        this.collection = collection;
    }

    @Override
    public List<RetrievedDocument> search(String query, int k, SearchMode mode) {
        SearchPayload payload = new SearchPayload(query, k, mode.wireName());
        try {
            SearchResponse response = vectorStoreWebClient.post()
                    .uri("/collections/{collection}/search", collection)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(SearchResponse.class)
                    .onErrorResume(throwable -> Mono.error(
                            new VectorStoreException("Vector store search failed: " + throwable.getMessage(), throwable)))
                    .block();
            if (response == null) {
                return Collections.emptyList();
            }
            return response.toDocuments();
        } catch (VectorStoreException ex) {
            throw ex;
        } catch (Exception e) {
            throw new VectorStoreException("Failed to query vector store", e);
        }
    }

    private record SearchPayload(String query, int k, @JsonProperty("search_type") String searchType) {}

    private record SearchResponse(List<Document> documents) {
        List<RetrievedDocument> toDocuments() {
            return documents == null ? Collections.emptyList() : documents.stream().map(Document::toDocument).toList();
        }
    }

    private record Document(@JsonAlias("page_content") String content, Metadata metadata) {
        RetrievedDocument toDocument() {
            if (metadata == null) {
                return new RetrievedDocument(content == null ? "" : content, null, null);
            }
            return new RetrievedDocument(content == null ? "" : content, metadata.source(), metadata.page());
        }
    }

    private record Metadata(String source, @JsonProperty("page") @JsonAlias("page_number") Integer page) {}
}
