package com.meddollina.assistant.model;

import java.util.Optional;

public record RetrievedDocument(String content, String source, Integer page) {

    public Optional<String> sourceLink() {
        if (source == null || source.isBlank() || page == null) {
            return Optional.empty();
        }
        return Optional.of(source + " (Page: " + page + ")");
    }
}
