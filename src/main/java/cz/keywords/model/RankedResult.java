package cz.keywords.model;

import lombok.Value;

import java.util.List;

/**
 * Final keyword ranking, best keyword first.
 */
@Value
public class RankedResult {
    List<RankedKeyword> keywords;

    /** All raw scores were equal, so every keyword got the midpoint score. */
    boolean degenerate;

    public static RankedResult empty() {
        return new RankedResult(List.of(), false);
    }

    public boolean isEmpty() {
        return keywords.isEmpty();
    }
}
