package com.meddollina.assistant.service.safety;

import java.util.function.Predicate;

/**
 * One entry of the ordered rule list: a predicate over the lower-cased, trimmed question.
 */
public record SafetyRule(String name, Predicate<String> matcher, SafetyVerdict verdict) {

    public boolean matches(String normalizedQuestion) {
        return matcher.test(normalizedQuestion);
    }
}
