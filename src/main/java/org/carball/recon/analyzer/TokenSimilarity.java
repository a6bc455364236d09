package org.carball.recon.analyzer;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Word-set overlap between two normalized headers.
 */
public final class TokenSimilarity {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[\\s\\p{Z}]+");

    static final Set<String> STOP_WORDS = Set.of(
            "of", "the", "and", "or", "in", "on", "at", "to", "for", "with", "by");

    private TokenSimilarity() {
        // Utility class - prevent instantiation
    }

    /**
     * Jaccard index of the whitespace-separated words of both strings with stop words removed.
     * Returns 0 when either side has no words left.
     */
    public static double similarity(String first, String second) {
        Set<String> words1 = significantWords(first);
        Set<String> words2 = significantWords(second);
        if (words1.isEmpty() || words2.isEmpty()) {
            return 0.0;
        }

        Set<String> common = new HashSet<>(words1);
        common.retainAll(words2);
        Set<String> union = new HashSet<>(words1);
        union.addAll(words2);

        return (double) common.size() / union.size();
    }

    static Set<String> significantWords(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(WORD_SEPARATOR.split(text))
                .filter(word -> !word.isEmpty() && !STOP_WORDS.contains(word))
                .collect(Collectors.toSet());
    }
}
