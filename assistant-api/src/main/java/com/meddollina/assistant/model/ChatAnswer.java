package com.meddollina.assistant.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatAnswer(
        String response,
        String heading,
        List<String> sources,
        String intent,
        @JsonProperty("tokens_used") long tokensUsed,
        @JsonProperty("processing_time") double processingTime
) {

    public static ChatAnswer from(AnswerResult result) {
        return new ChatAnswer(
                result.answer(),
                result.heading(),
                result.sources(),
                result.intent(),
                asLong(result.metadata().get("tokens_used")),
                asDouble(result.metadata().get("processing_time"))
        );
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static double asDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : 0.0;
    }
}
