package cz.keywords.text;

import java.util.List;
import java.util.Set;

/**
 * Removes tokens that carry little topical meaning. Both passes keep the order and
 * the repetitions of the surviving tokens.
 */
public class WordFilter {

    public static final int DEFAULT_MIN_WORD_LENGTH = 4;

    private final int minWordLength;

    public WordFilter() {
        this(DEFAULT_MIN_WORD_LENGTH);
    }

    public WordFilter(int minWordLength) {
        if (minWordLength < 1) {
            throw new IllegalArgumentException("minWordLength must be positive: " + minWordLength);
        }
        this.minWordLength = minWordLength;
    }

    public List<String> removeStopWords(List<String> tokens, Set<String> stopWords) {
        return tokens.stream()
            .filter(token -> !stopWords.contains(token))
            .toList();
    }

    /**
     * Drops every token shorter than the minimum length (by default, words of three characters or less).
     */
    public List<String> removeShortWords(List<String> tokens) {
        return tokens.stream()
            .filter(token -> token.codePointCount(0, token.length()) >= minWordLength)
            .toList();
    }
}
