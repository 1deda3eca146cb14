package cz.keywords.model;

import lombok.Value;

/**
 * One row of the reference word-frequency corpus.
 * Rank 1 is the most frequent word of the language.
 */
@Value
public class CorpusEntry {
    int rank;
    String word;
    long frequency;
}
