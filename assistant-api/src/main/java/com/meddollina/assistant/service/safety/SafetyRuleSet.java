package com.meddollina.assistant.service.safety;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Component
public class SafetyRuleSet {

    static final List<String> MISCONDUCT_FRAGMENTS = List.of(
            "take advantage",
            "advantage of",
            "sedated patient",
            "unconscious patient",
            "exploit patient",
            "inappropriate exam",
            "sexual harassment",
            "non-consensual",
            "without consent",
            "abuse patient"
    );

    static final List<String> PROFESSIONAL_ROLES = List.of("doctor", "physician", "medical", "nurse", "staff");

    static final List<String> ABUSE_TERMS = List.of("advantage", "exploit", "abuse", "inappropriate");

    static final List<String> MALICIOUS_PHRASES = List.of(
            "ignore instruction",
            "bypass rule",
            "show chain of thought",
            "internal prompt",
            "fake medical",
            "forge report",
            "overdose",
            "worsen condition",
            "prescription for",
            "write me a prescription",
            "show your prompt",
            "reveal rule",
            "toxic combination"
    );

    static final Set<String> FAREWELLS = Set.of("bye", "goodbye", "exit", "quit");

    private static final SafetyRule SEXUAL_MISCONDUCT = new SafetyRule(
            "sexual-misconduct",
            question -> containsAny(question, MISCONDUCT_FRAGMENTS)
                    && containsAny(question, PROFESSIONAL_ROLES)
                    && containsAny(question, ABUSE_TERMS),
            SafetyVerdict.SEXUAL_MISCONDUCT);

    private static final SafetyRule MALICIOUS_INTENT = new SafetyRule(
            "malicious-intent",
            question -> containsAny(question, MALICIOUS_PHRASES),
            SafetyVerdict.MALICIOUS_INTENT);

    private static final SafetyRule FAREWELL = new SafetyRule(
            "farewell",
            FAREWELLS::contains,
            SafetyVerdict.FAREWELL);

    private final List<SafetyRule> gateRules = List.of(SEXUAL_MISCONDUCT, MALICIOUS_INTENT, FAREWELL);
    private final List<SafetyRule> abuseRules = List.of(SEXUAL_MISCONDUCT, MALICIOUS_INTENT);

    /**
     * Full ordered evaluation used by the relevance gate, farewells included.
     */
    public Optional<SafetyRule> evaluate(String question) {
        return firstMatch(gateRules, question);
    }

    /**
     * Only the abuse rules; a farewell is not abusive.
     */
    public Optional<SafetyRule> detectAbuse(String question) {
        return firstMatch(abuseRules, question);
    }

    private Optional<SafetyRule> firstMatch(List<SafetyRule> rules, String question) {
        if (question == null) {
            return Optional.empty();
        }
        String normalized = question.trim().toLowerCase(Locale.ROOT);
        return rules.stream()
                .filter(rule -> rule.matches(normalized))
                .findFirst();
    }

    private static boolean containsAny(String text, List<String> fragments) {
        for (String fragment : fragments) {
            if (text.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
