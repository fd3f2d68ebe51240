package com.meddollina.assistant.service.metrics;

public interface ResponseQualityEvaluator {

    QualityScores evaluate(String question, String context, String response);
}
