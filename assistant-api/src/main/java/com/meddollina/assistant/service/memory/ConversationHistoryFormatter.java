package com.meddollina.assistant.service.memory;

import com.meddollina.assistant.model.ChatTurn;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Renders prior turns as a compact text block for prompts. Long answers are condensed to
 * their opening lines plus any labelled clinical lines so the specifics survive.
 */
@Component
public class ConversationHistoryFormatter {

    static final int CONDENSE_THRESHOLD = 800;
    static final int LEADING_LINES = 10;
    static final int MAX_LABELLED_LINES = 5;
    static final int MAX_PAIRS = 10;
    static final List<String> CLINICAL_LABELS = List.of(
            "diagnosis:", "condition:", "treatment:", "medication:",
            "patient:", "symptoms:", "surgery:", "procedure:");

    public String format(ConversationContext memory, String question) {
        if (memory == null) {
            return "";
        }
        List<ChatTurn> messages = memory.messages(question);
        if (messages.isEmpty()) {
            return "";
        }

        Deque<String> pairs = new ArrayDeque<>();
        for (int i = 0; i < messages.size(); i += 2) {
            String human = text(messages.get(i)).replace("Human:", "").strip();
            String assistant = i + 1 < messages.size() ? condense(text(messages.get(i + 1)).strip()) : "";
            pairs.addLast("Previous Question: " + human + "\nPrevious Response Summary: " + assistant);
            if (pairs.size() > MAX_PAIRS) {
                pairs.removeFirst();
            }
        }
        return String.join("\n\n", pairs);
    }

    String condense(String answer) {
        if (answer.length() <= CONDENSE_THRESHOLD) {
            return answer;
        }
        String[] lines = answer.split("\n", -1);
        List<String> leading = new ArrayList<>();
        for (int i = 0; i < Math.min(LEADING_LINES, lines.length); i++) {
            leading.add(lines[i].strip());
        }
        List<String> labelled = new ArrayList<>();
        for (String line : lines) {
            if (labelled.size() == MAX_LABELLED_LINES) {
                break;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            if (CLINICAL_LABELS.stream().anyMatch(lower::contains)) {
                labelled.add(line.strip());
            }
        }
        return String.join("\n", leading) + "\n...\n" + String.join("\n", labelled);
    }

    private static String text(ChatTurn turn) {
        return turn == null || turn.content() == null ? "" : turn.content();
    }
}
