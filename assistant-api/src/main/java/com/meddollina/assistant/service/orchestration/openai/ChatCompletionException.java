package com.meddollina.assistant.service.orchestration.openai;

public class ChatCompletionException extends RuntimeException {

    private final int status;

    public ChatCompletionException(String message) {
        this(message, 0, null);
    }

    public ChatCompletionException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public ChatCompletionException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }

    public boolean rateLimited() {
        return status == 429;
    }
}
