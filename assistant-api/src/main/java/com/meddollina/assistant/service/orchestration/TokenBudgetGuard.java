package com.meddollina.assistant.service.orchestration;

import com.meddollina.assistant.model.ChatTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Keeps the final prompt inside the model's input window. When the full prompt is over
 * budget it is rebuilt once from shortened context, history and reasoning.
 */
@Component
public class TokenBudgetGuard {

    private static final Logger log = LoggerFactory.getLogger(TokenBudgetGuard.class);

    static final int CONTEXT_CHARS = 2000;
    static final int HISTORY_CHARS = 1000;
    static final int REASONING_CHARS = 1000;
    static final String TRUNCATION_MARKER = "...[truncated for length]";

    private final TokenCounter tokenCounter;
    private final int maxInputTokens;

    public TokenBudgetGuard(TokenCounter tokenCounter,
                            @Value("${assistant.generation.max-input-tokens:6000}") int maxInputTokens) {
        this.tokenCounter = tokenCounter;
        this.maxInputTokens = maxInputTokens;
    }

    public GuardedPrompt enforce(PromptInputs inputs, Function<PromptInputs, List<ChatTurn>> promptBuilder) {
        List<ChatTurn> messages = promptBuilder.apply(inputs);
        int inputTokens = tokenCounter.count(messages);
        if (inputTokens <= maxInputTokens) {
            return new GuardedPrompt(messages, inputTokens, false);
        }

        PromptInputs shortened = new PromptInputs(
                truncateContext(inputs.context()),
                head(inputs.history(), HISTORY_CHARS),
                head(inputs.reasoning(), REASONING_CHARS));
        List<ChatTurn> rebuilt = promptBuilder.apply(shortened);
        int rebuiltTokens = tokenCounter.count(rebuilt);
        log.info("Prompt of {} tokens exceeded the {} token budget, truncated to {}", inputTokens, maxInputTokens, rebuiltTokens);
        return new GuardedPrompt(rebuilt, rebuiltTokens, true);
    }

    static String truncateContext(String context) {
        if (context == null || context.isEmpty()) {
            return "";
        }
        return head(context, CONTEXT_CHARS) + TRUNCATION_MARKER;
    }

    private static String head(String text, int limit) {
        if (text == null) {
            return "";
        }
        return text.length() <= limit ? text : text.substring(0, limit);
    }

    public record PromptInputs(String context, String history, String reasoning) {
        public PromptInputs {
            context = context == null ? "" : context;
            history = history == null ? "" : history;
            reasoning = reasoning == null ? "" : reasoning;
        }
    }

    public record GuardedPrompt(List<ChatTurn> messages, int inputTokens, boolean truncated) {
        public GuardedPrompt {
            messages = List.copyOf(messages);
        }
    }
}
