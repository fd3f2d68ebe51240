package com.meddollina.assistant.service.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meddollina.assistant.model.Intent;
import com.meddollina.assistant.model.IntentResult;
import com.meddollina.assistant.model.Urgency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns the classifier's raw reply into an {@link IntentResult}. Models often wrap the
 * object in a fenced block or surround it with prose, so the reply is narrowed to the
 * outermost braces before parsing.
 */
@Component
public class IntentResponseParser {

    private static final Logger log = LoggerFactory.getLogger(IntentResponseParser.class);
    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public IntentResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<IntentResult> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String cleaned = clean(raw);
        try {
            JsonNode node = objectMapper.readTree(cleaned);
            if (node == null || !node.isObject()) {
                log.warn("Intent response is not a JSON object");
                return Optional.empty();
            }
            return Optional.of(toResult(node));
        } catch (JsonProcessingException ex) {
            log.warn("Intent response could not be parsed: {}", ex.getOriginalMessage());
            return Optional.empty();
        } catch (IllegalArgumentException ex) {
            log.warn("Intent response has unsupported values: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    static String clean(String raw) {
        String cleaned = raw.strip();
        int fence = cleaned.indexOf(JSON_FENCE);
        if (fence >= 0) {
            int start = fence + JSON_FENCE.length();
            int end = cleaned.indexOf(FENCE, start);
            cleaned = (end >= 0 ? cleaned.substring(start, end) : cleaned.substring(start)).strip();
        } else if (cleaned.startsWith(FENCE)) {
            cleaned = cleaned.substring(FENCE.length());
            int end = cleaned.indexOf(FENCE);
            cleaned = (end >= 0 ? cleaned.substring(0, end) : cleaned).strip();
        }
        int open = cleaned.indexOf('{');
        int close = cleaned.lastIndexOf('}');
        if (open >= 0 && close > open) {
            cleaned = cleaned.substring(open, close + 1);
        }
        return cleaned;
    }

    private IntentResult toResult(JsonNode node) {
        Intent intent = Intent.fromWireName(node.path("intent").asText(null));
        Urgency urgency = Urgency.fromWireName(node.path("urgency").asText(null));
        return new IntentResult(
                intent,
                urgency,
                text(node, "focus_area"),
                text(node, "main_condition"),
                text(node, "needs_clarification"),
                node.path("requires_full_structure").asBoolean(false));
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }
}
