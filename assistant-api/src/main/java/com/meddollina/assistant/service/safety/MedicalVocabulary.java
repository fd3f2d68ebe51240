package com.meddollina.assistant.service.safety;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class MedicalVocabulary {

    static final List<String> MEDICAL_KEYWORDS = List.of(
            "symptom", "symptoms", "pain", "ache", "hurt", "surgery", "surgical", "operation",
            "doctor", "physician", "hospital", "clinic", "treatment", "medicine", "medication",
            "diagnosis", "diagnose", "disease", "condition", "illness", "sick", "health",
            "infection", "fever", "headache", "nausea", "vomiting", "bleeding", "swelling",
            "recovery", "healing", "wound", "injury", "fracture", "broken", "sprain",
            "cancer", "tumor", "cyst", "rash", "allergic", "allergy", "chest pain",
            "abdomen", "stomach", "liver", "kidney", "heart", "lung", "brain", "spine",
            "blood", "pressure", "diabetic", "diabetes", "hypertension",
            "prescription", "dosage", "side effect", "complication", "emergency",
            "urgent", "acute", "chronic", "patient", "medical history"
    );

    // the strongest signals, used when only the history carries the medical context
    static final List<String> HISTORY_KEYWORDS = MEDICAL_KEYWORDS.subList(0, 15);

    static final List<String> TEMPORAL_CONTEXTS = List.of(
            "days ago", "weeks ago", "months ago", "years ago", "yesterday", "last week",
            "last month", "since", "after", "before", "during", "following", "prior to",
            "recently", "lately", "ongoing", "persistent", "recurring", "intermittent"
    );

    static final List<String> HEALTH_INDICATORS = List.of(
            "feel", "feeling", "experience", "experiencing", "having", "been", "was", "got", "developed"
    );

    static final List<String> CONDITIONS = List.of(
            "anaplastic oligodendroglioma", "brain mass", "seizures", "glioma", "tumor",
            "cancer", "stroke", "heart attack", "pneumonia", "diabetes", "hypertension",
            "chest pain", "headache", "fever", "covid", "infection", "surgery"
    );

    static final int SHORT_FOLLOW_UP_WORDS = 10;

    private MedicalVocabulary() {
    }

    public static boolean isLikelyMedical(String question, String historyText) {
        String questionLower = question.toLowerCase(Locale.ROOT);
        if (containsAny(questionLower, MEDICAL_KEYWORDS)) {
            return true;
        }
        if (containsAny(questionLower, TEMPORAL_CONTEXTS) && containsAny(questionLower, HEALTH_INDICATORS)) {
            return true;
        }
        if (historyText != null && !historyText.isBlank() && wordCount(question) <= SHORT_FOLLOW_UP_WORDS) {
            return containsAny(historyText.toLowerCase(Locale.ROOT), HISTORY_KEYWORDS);
        }
        return false;
    }

    /**
     * First known condition mentioned in the text, with spaces replaced by underscores.
     */
    public static Optional<String> firstCondition(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return CONDITIONS.stream()
                .filter(lower::contains)
                .map(condition -> condition.replace(' ', '_'))
                .findFirst();
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
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
