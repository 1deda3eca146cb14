package cz.keywords.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A keyword in the final ranking with its normalized score (0.5 - 100).
 */
@Value
public class RankedKeyword {

    @JsonProperty("rank")
    int rank;

    @JsonProperty("word")
    String word;

    @JsonProperty("score")
    double score;
}
