package com.meddollina.assistant.service.retrieval;

import com.meddollina.assistant.model.RetrievedDocument;

import java.util.List;

public interface VectorStoreClient {

    /**
     * @throws VectorStoreException when the store cannot be queried
     */
    List<RetrievedDocument> search(String query, int k, SearchMode mode);
}
