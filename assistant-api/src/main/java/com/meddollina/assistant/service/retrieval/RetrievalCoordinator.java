package com.meddollina.assistant.service.retrieval;

import com.meddollina.assistant.model.RetrievedDocument;
import com.meddollina.assistant.service.metrics.OperationRecord;
import com.meddollina.assistant.service.metrics.PerformanceRecorder;
import com.meddollina.assistant.service.metrics.ResourceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fetches reference passages for a question. A failing store degrades to an empty
 * result so generation can still proceed without grounding.
 */
@Component
public class RetrievalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RetrievalCoordinator.class);

    private final VectorStoreClient vectorStore;
    private final EmbeddingsClient embeddings;
    private final PerformanceRecorder recorder;
    private final int topK;
    private final SearchMode searchMode;

    public RetrievalCoordinator(VectorStoreClient vectorStore,
                                EmbeddingsClient embeddings,
                                PerformanceRecorder recorder,
                                @Value("${assistant.retrieval.top-k:3}") int topK,
                                @Value("${assistant.retrieval.search-mode:mmr}") String searchMode) {
        this.vectorStore = vectorStore;
        this.embeddings = embeddings;
        this.recorder = recorder;
        this.topK = topK;
        this.searchMode = SearchMode.fromWireName(searchMode);
    }

    public RetrievalResult retrieve(String question) {
        long started = System.nanoTime();
        ResourceMonitor resources = recorder.resources();
        long memoryBefore = resources.usedMemoryBytes();

        List<RetrievedDocument> documents;
        try {
            documents = Objects.requireNonNullElse(vectorStore.search(question, topK, searchMode), List.of());
        } catch (RuntimeException ex) {
            log.warn("Retrieval failed, continuing without context: {}", ex.toString());
            recorder.recordError(OperationRecord.RETRIEVAL);
            documents = List.of();
        }

        for (RetrievedDocument document : documents) {
            recordEmbeddingSize(document, resources);
        }

        RetrievalResult result = assemble(documents);
        recorder.recordSources(result.sources());
        recorder.record(OperationRecord.of(OperationRecord.RETRIEVAL, 0, Duration.ofNanos(System.nanoTime() - started))
                .withMemoryDeltaBytes(resources.usedMemoryBytes() - memoryBefore));
        log.debug("Retrieved {} documents", documents.size());
        return result;
    }

    static RetrievalResult assemble(List<RetrievedDocument> documents) {
        List<String> sourceLinks = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        for (RetrievedDocument document : documents) {
            if (document.source() != null && !document.source().isBlank()) {
                sources.add(document.source());
            }
            document.sourceLink().ifPresent(sourceLinks::add);
        }
        String context = documents.stream()
                .map(RetrievedDocument::content)
                .collect(Collectors.joining("\n\n"));
        return new RetrievalResult(documents, sourceLinks, sources, context);
    }

    private void recordEmbeddingSize(RetrievedDocument document, ResourceMonitor resources) {
        if (document.content() == null || document.content().isBlank()) {
            return;
        }
        try {
            resources.recordEmbedding(embeddings.embed(document.content()).size());
        } catch (RuntimeException ex) {
            log.debug("Skipping embedding size for a document: {}", ex.toString());
        }
    }
}
