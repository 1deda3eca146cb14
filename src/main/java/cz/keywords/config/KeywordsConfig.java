package cz.keywords.config;

import lombok.Data;

@Data
public class KeywordsConfig {
    private String corpusPath = "corpus/syn2015_word_utf8.tsv";
    private int stopWordCount = 150;
    private int minWordLength = 4;
    private int maxResults = 20;
    private OutputLanguage language = OutputLanguage.CZE;
    private boolean simplePrint = false;
    private OutputFormat outputFormat = OutputFormat.TEXT;
    private boolean parallelLookup = false;

    /**
     * The subset of settings that affects scoring. Presentation settings are not part of it.
     */
    public PipelineSettings toPipelineSettings() {
        return new PipelineSettings(stopWordCount, minWordLength, maxResults, parallelLookup);
    }

    public OutputOptions toOutputOptions() {
        return new OutputOptions(language, simplePrint, outputFormat);
    }
}
