package com.synergi.core.worker.local;

import java.util.ArrayList;
import java.util.List;

/**
 * Extractive summarizer: keeps the leading third of the sentences, capped at a maximum length.
 */
final class TextSummarizer {

    private TextSummarizer() {}

    static String summarize(String text, int maxLength) {
        List<String> sentences = splitSentences(text);
        if (sentences.size() <= 2) {
            return text.substring(0, Math.min(maxLength, text.length()));
        }
        int keep = (int) Math.ceil(sentences.size() / 3.0);
        String summary = String.join(" ", sentences.subList(0, keep));
        if (summary.length() > maxLength) {
            summary = summary.substring(0, Math.max(0, maxLength - 3)) + "...";
        }
        return summary;
    }

    static List<String> splitSentences(String text) {
        List<String> sentences = new ArrayList<>();
        for (String part : text.split("(?<=[.!?])\\s+")) {
            if (!part.isBlank()) {
                sentences.add(part.trim());
            }
        }
        return sentences;
    }
}
