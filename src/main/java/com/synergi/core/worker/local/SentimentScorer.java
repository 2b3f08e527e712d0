package com.synergi.core.worker.local;

import java.util.Locale;
import java.util.Set;

/**
 * Lexicon-based sentiment: positive minus negative word hits.
 */
final class SentimentScorer {

    record Score(String label, int score) {}

    private static final Set<String> POSITIVE = Set.of(
            "good", "great", "excellent", "love", "happy", "amazing", "wonderful", "best", "like", "fantastic");
    private static final Set<String> NEGATIVE = Set.of(
            "bad", "terrible", "awful", "hate", "sad", "worst", "poor", "angry", "horrible", "dislike");

    private SentimentScorer() {}

    static Score score(String text) {
        int score = 0;
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            if (POSITIVE.contains(word)) {
                score++;
            } else if (NEGATIVE.contains(word)) {
                score--;
            }
        }
        String label = score > 0 ? "positive" : score < 0 ? "negative" : "neutral";
        return new Score(label, score);
    }
}
