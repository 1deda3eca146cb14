package cz.keywords.service;

import cz.keywords.TestCorpus;
import cz.keywords.config.PipelineSettings;
import cz.keywords.corpus.CorpusIndex;
import cz.keywords.exception.EmptyInputException;
import cz.keywords.io.DocumentSource;
import cz.keywords.model.ExtractionReport;
import cz.keywords.model.RankedKeyword;
import cz.keywords.util.ExecutorProvider;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static cz.keywords.TestCorpus.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KeywordExtractionServiceTest {

    private static final CorpusIndex CORPUS = new CorpusIndex(TestCorpus.withStopWords(
        entry("kočka", 5),
        entry("pes", 50),
        entry("zahrada", 300),
        entry("strom", 500)));

    @AfterAll
    static void shutdownExecutor() {
        ExecutorProvider.shutdown();
    }

    @Nested
    @DisplayName("Ranking")
    class Ranking {

        @Test
        @DisplayName("Rare corpus word with higher document frequency ranks first, unknown word is skipped")
        void shouldRankRareWordAboveCommonWord() {
            CorpusIndex corpus = new CorpusIndex(TestCorpus.withStopWords(entry("kočka", 5), entry("pes", 50)));
            KeywordExtractionService service = new KeywordExtractionService(new PipelineSettings(150, 3, 20, false));

            ExtractionReport report = service.extract("kočka kočka kočka pes pes strom", corpus);

            assertThat(report.getKeywords()).extracting(RankedKeyword::getWord).containsExactly("kočka", "pes");
            assertThat(report.getCandidateCount()).isEqualTo(3);
            assertThat(report.getScoredWordCount()).isEqualTo(2);
        }

        @Test
        void shouldSkipWordMissingFromCorpus() {
            KeywordExtractionService service = new KeywordExtractionService(new PipelineSettings(150, 3, 20, false));

            ExtractionReport report = service.extract("kočka kočka kočka pes pes hrad", CORPUS);

            assertThat(report.getKeywords()).extracting(RankedKeyword::getWord).containsExactly("kočka", "pes");
            assertThat(report.getKeywords().get(0).getScore()).isEqualTo(100.0);
            assertThat(report.getKeywords().get(1).getScore()).isEqualTo(0.5);
            assertThat(report.getCandidateCount()).isEqualTo(3);
            assertThat(report.getScoredWordCount()).isEqualTo(2);
        }

        @Test
        void shouldFillReportCounts() {
            KeywordExtractionService service = new KeywordExtractionService();

            ExtractionReport report = service.extract(
                "Kočka jsou kočka, strom! Strom jsou strom strom. Zahrada kočka zahrada pes 2024.", CORPUS);

            assertThat(report.getTokenCount()).isEqualTo(12);
            assertThat(report.getCorpusSize()).isEqualTo(154);
            assertThat(report.getRemovedStopWords()).isEqualTo(2);
            assertThat(report.getRemovedShortWords()).isEqualTo(1);
            assertThat(report.getFilteredTokenCount()).isEqualTo(9);
            assertThat(report.getUniqueWordCount()).isEqualTo(3);
            assertThat(report.getThreshold()).isEqualTo(1);
            assertThat(report.getRemovedUncommonWords()).isZero();
            assertThat(report.getCandidateCount()).isEqualTo(3);
            assertThat(report.getKeywords()).extracting(RankedKeyword::getRank).containsExactly(1, 2, 3);
            assertThat(report.getKeywords().get(0).getWord()).isEqualTo("kočka");
        }

        @Test
        void shouldCutOffUncommonWords() {
            List<String> words = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                words.add("kočka");
            }
            words.add("zahrada");
            words.add("strom");
            words.add("strom");

            ExtractionReport report = new KeywordExtractionService().extract(String.join(" ", words), CORPUS);

            // 15 words give a cutoff of 2
            assertThat(report.getThreshold()).isEqualTo(2);
            assertThat(report.getRemovedUncommonWords()).isEqualTo(1);
            assertThat(report.getKeywords()).extracting(RankedKeyword::getWord).containsExactly("kočka", "strom");
        }

        @Test
        void parallelLookupShouldGiveSameReport() {
            String text = "kočka kočka kočka zahrada zahrada strom strom strom strom hrad";

            ExtractionReport sequential = new KeywordExtractionService(new PipelineSettings(150, 4, 20, false))
                .extract(text, CORPUS);
            ExtractionReport parallel = new KeywordExtractionService(new PipelineSettings(150, 4, 20, true))
                .extract(text, CORPUS);

            assertThat(parallel).isEqualTo(sequential);
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        void singleScorableWordShouldGetMidpointScore() {
            ExtractionReport report = new KeywordExtractionService().extract("kočka kočka kočka pes pes strom", CORPUS);

            assertThat(report.isDegenerateScoreRange()).isFalse();
            assertThat(report.getKeywords()).hasSize(2);

            ExtractionReport single = new KeywordExtractionService().extract("kočka kočka pes", CORPUS);

            assertThat(single.isDegenerateScoreRange()).isTrue();
            assertThat(single.getKeywords()).singleElement()
                .satisfies(keyword -> assertThat(keyword.getScore()).isEqualTo(50.25));
        }

        @Test
        void shouldReportEmptyInputWhenOnlyStopWordsRemain() {
            KeywordExtractionService service = new KeywordExtractionService();

            assertThatThrownBy(() -> service.extract("a je jsou, je a.", CORPUS))
                .isInstanceOf(EmptyInputException.class);
            assertThatThrownBy(() -> service.extract("", CORPUS))
                .isInstanceOf(EmptyInputException.class);
        }

        @Test
        void shouldReturnEmptyResultWhenNoCandidateIsInCorpus() {
            ExtractionReport report = new KeywordExtractionService().extract("hrad hrad zámek", CORPUS);

            assertThat(report.isNoScorableWords()).isTrue();
            assertThat(report.isDegenerateScoreRange()).isFalse();
            assertThat(report.getKeywords()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Document source")
    class DocumentSourceHandling {

        @Test
        void shouldReadDocumentFromSource() throws IOException {
            DocumentSource document = mock(DocumentSource.class);
            when(document.readAll()).thenReturn("kočka kočka zahrada zahrada zahrada");

            ExtractionReport report = new KeywordExtractionService().extract(document, CORPUS);

            verify(document).readAll();
            assertThat(report.getDocument()).isNotNull();
            assertThat(report.getKeywords()).extracting(RankedKeyword::getWord).containsExactly("kočka", "zahrada");
        }

        @Test
        void shouldPropagateReadFailure() throws IOException {
            DocumentSource document = mock(DocumentSource.class);
            when(document.readAll()).thenThrow(new IOException("disk error"));

            assertThatThrownBy(() -> new KeywordExtractionService().extract(document, CORPUS))
                .isInstanceOf(IOException.class)
                .hasMessage("disk error");
        }
    }
}
