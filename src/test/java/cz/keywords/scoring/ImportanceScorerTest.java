package cz.keywords.scoring;

import cz.keywords.corpus.CorpusIndex;
import cz.keywords.model.CorpusEntry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImportanceScorerTest {

    private static final CorpusIndex CORPUS = new CorpusIndex(List.of(
        new CorpusEntry(1, "a", 1000),
        new CorpusEntry(2, "pes", 50),
        new CorpusEntry(3, "kočka", 5)));

    @AfterAll
    static void shutdownExecutor() {
        cz.keywords.util.ExecutorProvider.shutdown();
    }

    @Test
    void shouldApplyImportanceFormula() {
        FrequencyTable table = FrequencyTable.count(List.of("kočka", "kočka", "kočka", "pes", "pes", "strom"));

        Map<String, Double> scores = new ImportanceScorer().score(table, CORPUS);

        // unique = 3, total = 6, corpus size = 3
        double corpusTerm = (6 + 3) / 2.0;
        assertThat(scores.get("kočka")).isCloseTo(3.0 / 3 * Math.log(corpusTerm / 6 + 1), within(1e-12));
        assertThat(scores.get("pes")).isCloseTo(2.0 / 3 * Math.log(corpusTerm / 51 + 1), within(1e-12));
    }

    @Test
    void shouldSkipWordsMissingFromCorpus() {
        FrequencyTable table = FrequencyTable.count(List.of("kočka", "strom", "strom", "hrad"));

        Map<String, Double> scores = new ImportanceScorer().score(table, CORPUS);

        assertThat(scores).containsOnlyKeys("kočka");
        assertThat(table.contains("strom")).isTrue();
    }

    @Test
    void unknownWordsStillCountTowardsUniqueWords() {
        FrequencyTable withUnknown = FrequencyTable.count(List.of("kočka", "strom"));
        FrequencyTable withoutUnknown = FrequencyTable.count(List.of("kočka"));

        double shared = new ImportanceScorer().score(withUnknown, CORPUS).get("kočka");
        double alone = new ImportanceScorer().score(withoutUnknown, CORPUS).get("kočka");

        assertThat(shared).isLessThan(alone);
    }

    @Test
    void rarerCorpusWordShouldScoreHigherAtEqualDocumentFrequency() {
        FrequencyTable table = FrequencyTable.count(List.of("kočka", "pes"));

        Map<String, Double> scores = new ImportanceScorer().score(table, CORPUS);

        assertThat(scores.get("kočka")).isGreaterThan(scores.get("pes"));
    }

    @Test
    void shouldReturnEmptyMappingWhenNothingIsInCorpus() {
        FrequencyTable table = FrequencyTable.count(List.of("hrad", "zámek"));

        assertThat(new ImportanceScorer().score(table, CORPUS)).isEmpty();
        assertThat(new ImportanceScorer().score(FrequencyTable.count(List.of()), CORPUS)).isEmpty();
    }

    @Test
    void parallelLookupShouldMatchSequentialResult() {
        List<CorpusEntry> entries = new ArrayList<>();
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            entries.add(new CorpusEntry(i + 1, "slovo" + i, 10_000 - i * 7L));
            for (int j = 0; j <= i % 9; j++) {
                tokens.add("slovo" + (i * 3));
            }
        }
        CorpusIndex corpus = new CorpusIndex(entries);
        FrequencyTable table = FrequencyTable.count(tokens);

        Map<String, Double> sequential = new ImportanceScorer(false).score(table, corpus);
        Map<String, Double> parallel = new ImportanceScorer(true).score(table, corpus);

        assertThat(parallel).isNotEmpty();
        assertThat(parallel).containsExactlyEntriesOf(sequential);
    }
}
