package com.meddollina.assistant.service.orchestration;

import com.meddollina.assistant.model.GenerationRequest;

public interface ChatCompletionClient {

    /**
     * Returns the text of the first choice. Transport failures, rate limits and empty
     * choices surface as {@link com.meddollina.assistant.service.orchestration.openai.ChatCompletionException}.
     */
    String complete(GenerationRequest request);
}
