package com.meddollina.assistant.service;

import com.meddollina.assistant.model.AnswerResult;
import com.meddollina.assistant.model.Question;
import com.meddollina.assistant.service.memory.ConversationContext;

public interface QuestionAnsweringService {

    /**
     * Runs one question through the pipeline. Never throws; failures are reported through
     * {@link AnswerResult#outcome()}.
     */
    AnswerResult answer(Question question, ConversationContext memory);
}
