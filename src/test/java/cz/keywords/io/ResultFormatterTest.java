package cz.keywords.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.keywords.config.OutputFormat;
import cz.keywords.config.OutputLanguage;
import cz.keywords.config.OutputOptions;
import cz.keywords.model.ExtractionReport;
import cz.keywords.model.RankedKeyword;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultFormatterTest {

    private final List<String> lines = new ArrayList<>();
    private final ResultSink sink = lines::add;
    private ExtractionReport report;

    @BeforeEach
    void setUp() {
        report = new ExtractionReport();
        report.setTokenCount(11);
        report.setCorpusSize(152);
        report.setRemovedStopWords(2);
        report.setUniqueWordCount(3);
        report.setThreshold(1);
        report.setCandidateCount(3);
        report.setScoredWordCount(3);
        report.setKeywords(List.of(
            new RankedKeyword(1, "kočka", 100.0),
            new RankedKeyword(2, "zahrada", 50.25),
            new RankedKeyword(3, "strom", 0.5)));
    }

    @Test
    void verboseOutputShouldListRankWordAndScore() throws Exception {
        new ResultFormatter(new OutputOptions(OutputLanguage.ENG, false, OutputFormat.TEXT)).write(report, sink);

        assertThat(lines).contains("Loaded 11 words from input document.", "Loaded Czech corpus with 152 words.");
        assertThat(lines).endsWith("", "1. kočka (100)", "2. zahrada (50.25)", "3. strom (0.5)");
    }

    @Test
    void czechStatusLinesShouldBeDefault() throws Exception {
        new ResultFormatter(new OutputOptions(OutputLanguage.CZE, false, OutputFormat.TEXT)).write(report, sink);

        assertThat(lines.get(0)).isEqualTo("Načetl jsem 11 slov z input dokumentu.");
        assertThat(lines).contains("Odstranil jsem 2 stop slov ze seznamu.");
    }

    @Test
    void simplePrintShouldWriteWordsOnly() throws Exception {
        new ResultFormatter(new OutputOptions(OutputLanguage.ENG, true, OutputFormat.TEXT)).write(report, sink);

        assertThat(lines).containsExactly("kočka", "zahrada", "strom");
    }

    @Test
    void emptyResultShouldWriteNoKeywordLines() throws Exception {
        report.setKeywords(List.of());
        report.setNoScorableWords(true);

        new ResultFormatter(new OutputOptions(OutputLanguage.ENG, true, OutputFormat.TEXT)).write(report, sink);
        assertThat(lines).isEmpty();

        new ResultFormatter(new OutputOptions(OutputLanguage.ENG, false, OutputFormat.TEXT)).write(report, sink);
        assertThat(lines).contains("None of the candidate words is in the corpus, no keywords found.");
    }

    @Test
    void jsonOutputShouldContainWholeReport() throws Exception {
        new ResultFormatter(new OutputOptions(OutputLanguage.ENG, false, OutputFormat.JSON)).write(report, sink);

        assertThat(lines).hasSize(1);
        JsonNode json = new ObjectMapper().readTree(lines.get(0));
        assertThat(json.get("token_count").asInt()).isEqualTo(11);
        assertThat(json.get("keywords").size()).isEqualTo(3);
        assertThat(json.get("keywords").get(0).get("word").asText()).isEqualTo("kočka");
        assertThat(json.get("keywords").get(1).get("score").asDouble()).isEqualTo(50.25);
    }

    @Test
    void scoresShouldBePrintedWithoutTrailingZeros() {
        assertThat(ResultFormatter.formatScore(100.0)).isEqualTo("100");
        assertThat(ResultFormatter.formatScore(50.25)).isEqualTo("50.25");
        assertThat(ResultFormatter.formatScore(0.5)).isEqualTo("0.5");
        assertThat(ResultFormatter.formatScore(33.67)).isEqualTo("33.67");
        assertThat(ResultFormatter.formatScore(10.1)).isEqualTo("10.1");
    }
}
