package cz.keywords.scoring;

import cz.keywords.corpus.CorpusIndex;
import cz.keywords.exception.KeywordExtractionException;
import cz.keywords.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Assigns a raw importance value to every candidate word that appears in the corpus.
 * <p>
 * The importance of a word is
 * <pre>
 *   (docFrequency / uniqueWordCount) * ln(((totalFrequency + corpusSize) / 2) / (1 + corpusFrequency) + 1)
 * </pre>
 * where {@code uniqueWordCount} and {@code totalFrequency} describe the pruned frequency table.
 * Words missing from the corpus get no value at all. Raw values are only comparable within one run.
 */
public class ImportanceScorer {
    private static final Logger logger = LoggerFactory.getLogger(ImportanceScorer.class);

    private final boolean parallel;

    public ImportanceScorer() {
        this(false);
    }

    /**
     * @param parallel look words up on the shared executor instead of the calling thread
     */
    public ImportanceScorer(boolean parallel) {
        this.parallel = parallel;
    }

    public Map<String, Double> score(FrequencyTable table, CorpusIndex corpus) {
        Map<String, Double> importances = new LinkedHashMap<>();
        if (table.isEmpty()) {
            return importances;
        }

        int uniqueWordCount = table.size();
        double corpusTerm = (table.totalFrequency() + (double) corpus.size()) / 2;

        if (parallel) {
            scoreConcurrently(table, corpus, uniqueWordCount, corpusTerm, importances);
        } else {
            for (Map.Entry<String, Integer> entry : table.asMap().entrySet()) {
                importance(entry.getKey(), entry.getValue(), uniqueWordCount, corpusTerm, corpus)
                    .ifPresent(value -> importances.put(entry.getKey(), value));
            }
        }

        logger.debug("Scored {} of {} candidate words", importances.size(), uniqueWordCount);
        return importances;
    }

    private void scoreConcurrently(FrequencyTable table, CorpusIndex corpus, int uniqueWordCount,
                                   double corpusTerm, Map<String, Double> importances) {
        List<String> words = new ArrayList<>(table.asMap().keySet());
        List<CompletableFuture<OptionalDouble>> futures = new ArrayList<>(words.size());
        for (String word : words) {
            int docFrequency = table.get(word);
            futures.add(CompletableFuture.supplyAsync(
                () -> importance(word, docFrequency, uniqueWordCount, corpusTerm, corpus),
                ExecutorProvider.getExecutor()));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw new KeywordExtractionException("Concurrent importance scoring failed", e.getCause());
        }

        // Collect in table order so the result matches the sequential path.
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            futures.get(i).join().ifPresent(value -> importances.put(word, value));
        }
    }

    private OptionalDouble importance(String word, int docFrequency, int uniqueWordCount,
                                      double corpusTerm, CorpusIndex corpus) {
        OptionalLong corpusFrequency = corpus.lookup(word);
        if (corpusFrequency.isEmpty()) {
            return OptionalDouble.empty();
        }
        double relativeFrequency = (double) docFrequency / uniqueWordCount;
        double rarity = Math.log(corpusTerm / (1 + corpusFrequency.getAsLong()) + 1);
        return OptionalDouble.of(relativeFrequency * rarity);
    }
}
