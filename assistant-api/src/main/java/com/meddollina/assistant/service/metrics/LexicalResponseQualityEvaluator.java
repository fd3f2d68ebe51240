package com.meddollina.assistant.service.metrics;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cheap lexical approximations of the response quality figures: Flesch reading ease,
 * bag-of-words cosine coherence, unsupported capitalised terms as a hallucination estimate
 * and mean pairwise sentence overlap as redundancy.
 */
@Component
public class LexicalResponseQualityEvaluator implements ResponseQualityEvaluator {

    private static final Pattern WORD = Pattern.compile("[A-Za-z][A-Za-z'-]*");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+|\\n+");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiouy]+");
    private static final Pattern CAPITALISED = Pattern.compile("\\b[A-Z][A-Za-z0-9-]{2,}\\b");

    @Override
    public QualityScores evaluate(String question, String context, String response) {
        return new QualityScores(
                readability(response),
                (cosine(termFrequencies(question), termFrequencies(response))
                        + cosine(termFrequencies(context), termFrequencies(response))) / 2.0,
                hallucinationRate(response, context),
                redundancyRate(response));
    }

    double readability(String text) {
        List<String> words = words(text);
        if (words.isEmpty()) {
            return 0.0;
        }
        int sentences = Math.max(1, sentences(text).size());
        int syllables = 0;
        for (String word : words) {
            syllables += syllables(word);
        }
        return 206.835
                - 1.015 * ((double) words.size() / sentences)
                - 84.6 * ((double) syllables / words.size());
    }

    double hallucinationRate(String response, String context) {
        Set<String> responseTerms = new HashSet<>();
        for (String sentence : sentences(response)) {
            Matcher matcher = CAPITALISED.matcher(sentence);
            boolean first = true;
            while (matcher.find()) {
                // the first word of a sentence is capitalised anyway
                if (first && matcher.start() == leadingOffset(sentence)) {
                    first = false;
                    continue;
                }
                first = false;
                responseTerms.add(matcher.group().toLowerCase(Locale.ROOT));
            }
        }
        if (responseTerms.isEmpty()) {
            return 0.0;
        }
        String contextLower = context == null ? "" : context.toLowerCase(Locale.ROOT);
        long unsupported = responseTerms.stream().filter(term -> !contextLower.contains(term)).count();
        return (double) unsupported / responseTerms.size();
    }

    double redundancyRate(String text) {
        List<Set<String>> sentenceWords = new ArrayList<>();
        for (String sentence : sentences(text)) {
            Set<String> unique = new HashSet<>(words(sentence.toLowerCase(Locale.ROOT)));
            if (!unique.isEmpty()) {
                sentenceWords.add(unique);
            }
        }
        if (sentenceWords.size() <= 1) {
            return 0.0;
        }
        double total = 0.0;
        int pairs = 0;
        for (int i = 0; i < sentenceWords.size(); i++) {
            for (int j = i + 1; j < sentenceWords.size(); j++) {
                total += jaccard(sentenceWords.get(i), sentenceWords.get(j));
                pairs++;
            }
        }
        return total / pairs;
    }

    private static double jaccard(Set<String> left, Set<String> right) {
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return union.isEmpty() ? 0.0 : (double) intersection.size() / union.size();
    }

    private static double cosine(Map<String, Integer> left, Map<String, Integer> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        double dot = 0.0;
        for (Map.Entry<String, Integer> entry : left.entrySet()) {
            Integer other = right.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * other;
            }
        }
        return dot / (norm(left) * norm(right));
    }

    private static double norm(Map<String, Integer> vector) {
        double sum = 0.0;
        for (int value : vector.values()) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }

    private static Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> frequencies = new HashMap<>();
        for (String word : words(text == null ? "" : text.toLowerCase(Locale.ROOT))) {
            frequencies.merge(word, 1, Integer::sum);
        }
        return frequencies;
    }

    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        if (text == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    private static List<String> sentences(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null) {
            return sentences;
        }
        for (String part : SENTENCE_END.split(text)) {
            if (!part.isBlank()) {
                sentences.add(part.strip());
            }
        }
        return sentences;
    }

    private static int leadingOffset(String sentence) {
        Matcher matcher = WORD.matcher(sentence);
        return matcher.find() ? matcher.start() : -1;
    }

    static int syllables(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        Matcher matcher = VOWEL_GROUP.matcher(lower);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        if (lower.endsWith("e") && !lower.endsWith("le") && count > 1) {
            count--;
        }
        return Math.max(1, count);
    }
}
