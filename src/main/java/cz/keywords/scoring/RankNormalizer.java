package cz.keywords.scoring;

import cz.keywords.model.RankedKeyword;
import cz.keywords.model.RankedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders raw importance values and rescales them linearly to 0.5 - 100.
 * <p>
 * Ranking is by score descending, ties broken by word descending. The scaled value is rounded to
 * two decimals first and 0.5 is added afterwards; the sum is not rounded again. Rounding works on the
 * exact binary value of the double, so {@code 1.005} (stored slightly below) becomes {@code 1.00}.
 */
public class RankNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(RankNormalizer.class);

    public static final int DEFAULT_MAX_RESULTS = 20;
    public static final double MIN_SCORE = 0.5;
    public static final double MAX_SCORE = 100.0;
    public static final double MIDPOINT_SCORE = (MIN_SCORE + MAX_SCORE) / 2;

    private static final double SCALE = MAX_SCORE - MIN_SCORE;

    private static final Comparator<Map.Entry<String, Double>> BY_SCORE_THEN_WORD =
        Map.Entry.<String, Double>comparingByValue().reversed()
            .thenComparing(Map.Entry.<String, Double>comparingByKey().reversed());

    private final int maxResults;

    public RankNormalizer() {
        this(DEFAULT_MAX_RESULTS);
    }

    public RankNormalizer(int maxResults) {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        this.maxResults = maxResults;
    }

    public RankedResult normalize(Map<String, Double> rawScores) {
        if (rawScores.isEmpty()) {
            return RankedResult.empty();
        }

        List<Map.Entry<String, Double>> sorted = new ArrayList<>(rawScores.entrySet());
        sorted.sort(BY_SCORE_THEN_WORD);

        double maxScore = sorted.get(0).getValue();
        double minScore = sorted.get(sorted.size() - 1).getValue();
        boolean degenerate = maxScore == minScore;
        if (degenerate) {
            logger.warn("All {} keyword scores are equal, using midpoint score {}", sorted.size(), MIDPOINT_SCORE);
        }

        List<Map.Entry<String, Double>> normalized = new ArrayList<>(sorted.size());
        for (Map.Entry<String, Double> entry : sorted) {
            double score = degenerate
                ? MIDPOINT_SCORE
                : scale(entry.getValue(), minScore, maxScore);
            normalized.add(Map.entry(entry.getKey(), score));
        }
        // Rounding can only merge neighbours; re-sorting orders such ties by word.
        normalized.sort(BY_SCORE_THEN_WORD);

        int limit = Math.min(maxResults, normalized.size());
        List<RankedKeyword> keywords = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            Map.Entry<String, Double> entry = normalized.get(i);
            keywords.add(new RankedKeyword(i + 1, entry.getKey(), entry.getValue()));
        }
        return new RankedResult(List.copyOf(keywords), degenerate);
    }

    static double scale(double score, double minScore, double maxScore) {
        double scaled = round2((score - minScore) / (maxScore - minScore) * SCALE);
        return scaled + MIN_SCORE;
    }

    static double round2(double value) {
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
