package cz.keywords.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import cz.keywords.config.OutputFormat;
import cz.keywords.config.OutputOptions;
import cz.keywords.model.ExtractionReport;
import cz.keywords.model.RankedKeyword;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders an {@link ExtractionReport} to a {@link ResultSink}.
 * <p>
 * Text output has one line per keyword, {@code "<rank>. <word> (<score>)"} or just {@code "<word>"} with
 * simple printing. JSON output is a single indented document holding the whole report.
 */
public class ResultFormatter {

    private final OutputOptions options;
    private final ObjectMapper objectMapper;

    public ResultFormatter(OutputOptions options) {
        this.options = options;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(ExtractionReport report, ResultSink sink) throws IOException {
        if (options.getFormat() == OutputFormat.JSON) {
            sink.writeLine(objectMapper.writeValueAsString(report));
            return;
        }

        if (!options.isSimplePrint()) {
            for (String line : new StatusMessages(options.getLanguage()).describe(report)) {
                sink.writeLine(line);
            }
        }
        for (RankedKeyword keyword : report.getKeywords()) {
            sink.writeLine(formatLine(keyword));
        }
    }

    public String formatLine(RankedKeyword keyword) {
        if (options.isSimplePrint()) {
            return keyword.getWord();
        }
        return keyword.getRank() + ". " + keyword.getWord() + " (" + formatScore(keyword.getScore()) + ")";
    }

    /**
     * Two decimals at most, trailing zeros dropped: {@code 100}, {@code 50.25}, {@code 0.5}.
     */
    public static String formatScore(double score) {
        BigDecimal value = BigDecimal.valueOf(score).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        return value.toPlainString();
    }
}
