package com.autonomous.analysis.sink;

import com.autonomous.analysis.model.AgentResult;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class InsightExtractor {

    static final String KEY_INSIGHTS_FIELD = "key_insights";
    static final int MAX_INSIGHTS = 5;
    static final int MAX_SENTENCES = 3;
    static final int MIN_SENTENCE_LENGTH = 10;

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?。！？])\\s*");

    public List<String> extract(AgentResult result) {
        List<String> insights = new ArrayList<>();
        Object listed = result.getFields().get(KEY_INSIGHTS_FIELD);
        if (listed instanceof List<?> items) {
            for (Object item : items) {
                if (item != null && !item.toString().isBlank()) {
                    insights.add(item.toString().trim());
                }
            }
        }
        if (insights.isEmpty() && result.getSummary() != null) {
            insights.addAll(leadingSentences(result.getSummary()));
        }
        return insights.size() > MAX_INSIGHTS ? List.copyOf(insights.subList(0, MAX_INSIGHTS)) : List.copyOf(insights);
    }

    // Of the first three sentences, those longer than ten characters.
    static List<String> leadingSentences(String text) {
        List<String> sentences = new ArrayList<>();
        String[] parts = SENTENCE_END.split(text.trim());
        for (int i = 0; i < Math.min(MAX_SENTENCES, parts.length); i++) {
            String sentence = parts[i].trim();
            if (sentence.length() > MIN_SENTENCE_LENGTH) {
                sentences.add(sentence);
            }
        }
        return sentences;
    }
}
