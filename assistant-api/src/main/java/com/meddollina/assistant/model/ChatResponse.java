package com.meddollina.assistant.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatResponse<T>(
        boolean success,
        T data,
        String message
) {

    public static <T> ChatResponse<T> ok(T data) {
        return new ChatResponse<>(true, data, null);
    }

    public static <T> ChatResponse<T> failure(String message) {
        return new ChatResponse<>(false, null, message);
    }
}
