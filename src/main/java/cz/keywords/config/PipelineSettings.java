package cz.keywords.config;

import lombok.Value;

/**
 * Settings consumed by the scoring pipeline.
 */
@Value
public class PipelineSettings {
    int stopWordCount;
    int minWordLength;
    int maxResults;
    boolean parallelLookup;

    public static PipelineSettings defaults() {
        return new KeywordsConfig().toPipelineSettings();
    }
}
