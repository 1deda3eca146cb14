package cz.keywords.scoring;

import cz.keywords.exception.EmptyInputException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Occurrence counts of the distinct tokens of a document, in order of first appearance.
 * <p>
 * After {@link #pruneByThreshold(int)} the table holds only the candidate words for scoring.
 */
public class FrequencyTable {

    private final Map<String, Integer> counts;

    private FrequencyTable(Map<String, Integer> counts) {
        this.counts = counts;
    }

    public static FrequencyTable count(List<String> tokens) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return new FrequencyTable(counts);
    }

    /**
     * Minimum occurrence count a word needs to stay a candidate:
     * {@code round(log10(totalTokenCount) + 0.5)}, rounding half up.
     *
     * @param totalTokenCount number of tokens left after stop-word and short-word filtering
     * @throws EmptyInputException if {@code totalTokenCount} is zero or negative
     */
    public static int threshold(int totalTokenCount) {
        if (totalTokenCount < 1) {
            throw new EmptyInputException(totalTokenCount);
        }
        return (int) Math.round(Math.log10(totalTokenCount) + 0.5);
    }

    /**
     * Removes every word that occurs fewer times than {@link #threshold(int)}.
     *
     * @return the threshold that was applied
     */
    public int pruneByThreshold(int totalTokenCount) {
        int threshold = threshold(totalTokenCount);
        counts.values().removeIf(count -> count < threshold);
        return threshold;
    }

    public int get(String word) {
        return counts.getOrDefault(word, 0);
    }

    public boolean contains(String word) {
        return counts.containsKey(word);
    }

    /**
     * Number of distinct words.
     */
    public int size() {
        return counts.size();
    }

    /**
     * Sum of the occurrence counts of all words.
     */
    public int totalFrequency() {
        int total = 0;
        for (int count : counts.values()) {
            total += count;
        }
        return total;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }
}
