package cz.keywords.service;

import cz.keywords.config.PipelineSettings;
import cz.keywords.corpus.CorpusIndex;
import cz.keywords.io.DocumentSource;
import cz.keywords.model.ExtractionReport;
import cz.keywords.model.RankedResult;
import cz.keywords.scoring.FrequencyTable;
import cz.keywords.scoring.ImportanceScorer;
import cz.keywords.scoring.RankNormalizer;
import cz.keywords.text.Tokenizer;
import cz.keywords.text.WordFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the keyword extraction pipeline on one document:
 * tokenize, drop stop words and short words, count, cut off uncommon words, score against the corpus
 * and normalize the ranking.
 */
public class KeywordExtractionService {
    private static final Logger logger = LoggerFactory.getLogger(KeywordExtractionService.class);

    private final PipelineSettings settings;
    private final Tokenizer tokenizer;
    private final WordFilter wordFilter;
    private final ImportanceScorer importanceScorer;
    private final RankNormalizer rankNormalizer;

    public KeywordExtractionService() {
        this(PipelineSettings.defaults());
    }

    public KeywordExtractionService(PipelineSettings settings) {
        this.settings = settings;
        this.tokenizer = new Tokenizer();
        this.wordFilter = new WordFilter(settings.getMinWordLength());
        this.importanceScorer = new ImportanceScorer(settings.isParallelLookup());
        this.rankNormalizer = new RankNormalizer(settings.getMaxResults());
    }

    public ExtractionReport extract(DocumentSource document, CorpusIndex corpus) throws IOException {
        ExtractionReport report = extract(document.readAll(), corpus);
        report.setDocument(document.toString());
        return report;
    }

    /**
     * @throws cz.keywords.exception.EmptyInputException if no word survives stop-word and short-word filtering
     */
    public ExtractionReport extract(String text, CorpusIndex corpus) {
        ExtractionReport report = new ExtractionReport();
        report.setCorpusSize(corpus.size());

        List<String> tokens = tokenizer.tokenize(text);
        report.setTokenCount(tokens.size());
        logger.debug("Tokenized document into {} words", tokens.size());

        Set<String> stopWords = corpus.topByRank(settings.getStopWordCount());
        List<String> withoutStopWords = wordFilter.removeStopWords(tokens, stopWords);
        report.setRemovedStopWords(tokens.size() - withoutStopWords.size());

        List<String> filtered = wordFilter.removeShortWords(withoutStopWords);
        report.setRemovedShortWords(withoutStopWords.size() - filtered.size());
        report.setFilteredTokenCount(filtered.size());
        logger.debug("Removed {} stop words and {} short words",
            report.getRemovedStopWords(), report.getRemovedShortWords());

        FrequencyTable frequencies = FrequencyTable.count(filtered);
        int uniqueWords = frequencies.size();
        report.setUniqueWordCount(uniqueWords);

        int threshold = frequencies.pruneByThreshold(filtered.size());
        report.setThreshold(threshold);
        report.setRemovedUncommonWords(uniqueWords - frequencies.size());
        report.setCandidateCount(frequencies.size());
        logger.debug("Cutoff frequency {} left {} of {} unique words", threshold, frequencies.size(), uniqueWords);

        Map<String, Double> importances = importanceScorer.score(frequencies, corpus);
        report.setScoredWordCount(importances.size());
        if (importances.isEmpty()) {
            logger.warn("None of the {} candidate words was found in the corpus", frequencies.size());
            report.setNoScorableWords(true);
        }

        RankedResult ranking = rankNormalizer.normalize(importances);
        report.setDegenerateScoreRange(ranking.isDegenerate());
        report.setKeywords(ranking.getKeywords());

        logger.info("Extracted {} keywords from {} words ({} candidates, {} scored)",
            ranking.getKeywords().size(), tokens.size(), frequencies.size(), importances.size());
        return report;
    }
}
