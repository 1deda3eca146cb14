package cz.keywords.corpus;

import cz.keywords.model.CorpusEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Immutable view over the ordered corpus entries.
 * <p>
 * Supports two lookups: the words of the first {@code n} entries (used as stop words) and the
 * frequency of a single word. When the corpus contains the same word more than once, only its first
 * occurrence in supplied order is visible to {@link #lookup(String)}.
 */
public class CorpusIndex {
    private static final Logger logger = LoggerFactory.getLogger(CorpusIndex.class);

    private final List<CorpusEntry> entries;
    private final Map<String, Long> frequencyByWord;
    private final int duplicateWordCount;

    public CorpusIndex(List<CorpusEntry> entries) {
        this.entries = List.copyOf(entries);
        this.frequencyByWord = new HashMap<>(Math.max(16, this.entries.size() * 4 / 3 + 1));

        int duplicates = 0;
        for (CorpusEntry entry : this.entries) {
            if (frequencyByWord.putIfAbsent(entry.getWord(), entry.getFrequency()) != null) {
                duplicates++;
            }
        }
        this.duplicateWordCount = duplicates;

        if (duplicates > 0) {
            logger.warn("Corpus contains {} duplicate words, only the first occurrence of each is used", duplicates);
        }
        logger.debug("Indexed {} corpus entries ({} distinct words)", this.entries.size(), frequencyByWord.size());
    }

    public static CorpusIndex load(CorpusSource source) throws IOException {
        return new CorpusIndex(source.loadEntries());
    }

    /**
     * Words of the first {@code n} entries in supplied order. Returns all words if the corpus is smaller.
     */
    public Set<String> topByRank(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative: " + n);
        }
        Set<String> words = new LinkedHashSet<>();
        for (CorpusEntry entry : entries.subList(0, Math.min(n, entries.size()))) {
            words.add(entry.getWord());
        }
        return Collections.unmodifiableSet(words);
    }

    /**
     * Frequency of the first entry whose word equals {@code word} exactly, or empty if there is none.
     */
    public OptionalLong lookup(String word) {
        Long frequency = frequencyByWord.get(word);
        return frequency == null ? OptionalLong.empty() : OptionalLong.of(frequency);
    }

    public int size() {
        return entries.size();
    }

    public int getDuplicateWordCount() {
        return duplicateWordCount;
    }
}
