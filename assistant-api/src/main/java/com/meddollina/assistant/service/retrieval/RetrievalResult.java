package com.meddollina.assistant.service.retrieval;

import com.meddollina.assistant.model.RetrievedDocument;

import java.util.List;

/**
 * @param sourceLinks "source (Page: n)" for documents that carry both fields
 * @param sources     raw source identifiers, one per document
 */
public record RetrievalResult(
        List<RetrievedDocument> documents,
        List<String> sourceLinks,
        List<String> sources,
        String contextText
) {

    public RetrievalResult {
        documents = List.copyOf(documents);
        sourceLinks = List.copyOf(sourceLinks);
        sources = List.copyOf(sources);
        contextText = contextText == null ? "" : contextText;
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
