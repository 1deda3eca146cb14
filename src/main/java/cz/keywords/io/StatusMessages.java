package cz.keywords.io;

import cz.keywords.config.OutputLanguage;
import cz.keywords.model.ExtractionReport;

import java.util.ArrayList;
import java.util.List;

/**
 * Progress lines printed before the keyword list in verbose text mode.
 */
public class StatusMessages {

    private final OutputLanguage language;

    public StatusMessages(OutputLanguage language) {
        this.language = language;
    }

    public List<String> describe(ExtractionReport report) {
        List<String> lines = new ArrayList<>();
        lines.add(pick(
            "Načetl jsem " + report.getTokenCount() + " slov z input dokumentu.",
            "Loaded " + report.getTokenCount() + " words from input document."));
        lines.add(pick(
            "Načetl jsem český korpus s " + report.getCorpusSize() + " slovy.",
            "Loaded Czech corpus with " + report.getCorpusSize() + " words."));
        lines.add(pick(
            "Odstranil jsem " + report.getRemovedStopWords() + " stop slov ze seznamu.",
            "Removed " + report.getRemovedStopWords() + " stop words from the word list."));
        lines.add(pick(
            "Odstranil jsem " + report.getRemovedShortWords() + " krátkých slov ze seznamu.",
            "Removed " + report.getRemovedShortWords() + " short words from the word list."));
        lines.add(pick(
            "Načetl jsem " + report.getUniqueWordCount() + " unikátních slov z input dokumentu.",
            "Loaded " + report.getUniqueWordCount() + " unique words from input document."));
        lines.add(pick(
            "Odstraňuji slova s frekvencí méně než " + report.getThreshold() + ": odstranil jsem "
                + report.getRemovedUncommonWords() + " neobvyklých slov ze seznamu frekvencí.",
            "Cutting off words with an occurrence less than " + report.getThreshold() + ": removed "
                + report.getRemovedUncommonWords() + " unusual words from the frequencies list."));
        lines.add(pick(
            "Počítám důležitost až " + report.getCandidateCount() + " slov.",
            "Assigning an importance value to up to " + report.getCandidateCount() + " words."));
        if (report.isNoScorableWords()) {
            lines.add(pick(
                "Žádné z kandidátních slov není v korpusu, nenašel jsem žádná klíčová slova.",
                "None of the candidate words is in the corpus, no keywords found."));
        }
        lines.add("");
        return lines;
    }

    private String pick(String czech, String english) {
        return language == OutputLanguage.CZE ? czech : english;
    }
}
