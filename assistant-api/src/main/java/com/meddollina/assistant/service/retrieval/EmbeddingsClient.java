package com.meddollina.assistant.service.retrieval;

import java.util.List;

public interface EmbeddingsClient {

    List<Double> embed(String text);
}
