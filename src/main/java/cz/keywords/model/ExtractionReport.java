package cz.keywords.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one extraction run: the counts of every pipeline stage and the ranked keywords.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractionReport {

    @JsonProperty("document")
    private String document;

    @JsonProperty("token_count")
    private int tokenCount;

    @JsonProperty("corpus_size")
    private int corpusSize;

    @JsonProperty("removed_stop_words")
    private int removedStopWords;

    @JsonProperty("removed_short_words")
    private int removedShortWords;

    @JsonProperty("filtered_token_count")
    private int filteredTokenCount;

    @JsonProperty("unique_word_count")
    private int uniqueWordCount;

    @JsonProperty("threshold")
    private int threshold;

    @JsonProperty("removed_uncommon_words")
    private int removedUncommonWords;

    @JsonProperty("candidate_count")
    private int candidateCount;

    @JsonProperty("scored_word_count")
    private int scoredWordCount;

    @JsonProperty("no_scorable_words")
    private boolean noScorableWords;

    @JsonProperty("degenerate_score_range")
    private boolean degenerateScoreRange;

    @JsonProperty("keywords")
    private List<RankedKeyword> keywords = new ArrayList<>();
}
