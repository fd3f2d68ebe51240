package com.meddollina.assistant.service.orchestration;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes chatty lead-ins ("Here's...:", "In summary:", "Response:") and keeps at most one
 * blank line between paragraphs.
 */
@Component
public class ResponseCleaner {

    static final Pattern BOILERPLATE = Pattern.compile(
            "(?i)(?:Please provide.?\\.|Here['’]s.?:|Let me explain:|According to the data:|In summary:"
                    + "|Explanation:|Clarification:|Here is my response:|AI Assistant:|Response:|Answer:|System:)");

    public String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        boolean previousBlank = true;
        for (String line : raw.split("\\R", -1)) {
            String cleaned = BOILERPLATE.matcher(line).replaceAll("").strip();
            if (cleaned.isEmpty()) {
                previousBlank = true;
                continue;
            }
            if (previousBlank && !lines.isEmpty()) {
                lines.add("");
            }
            previousBlank = false;
            lines.add(cleaned);
        }
        return String.join("\n", lines).strip();
    }
}
