package cz.keywords.corpus;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import cz.keywords.exception.CorpusFormatException;
import cz.keywords.model.CorpusEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads a tab-separated corpus file with rows {@code rank<TAB>word<TAB>frequency}.
 * The file has no header and no quoting; words are lowercased and rows keep file order.
 * Rows that cannot be parsed, and rows with a rank below 1 or a negative frequency, are skipped.
 */
public class TsvCorpusSource implements CorpusSource {
    private static final Logger logger = LoggerFactory.getLogger(TsvCorpusSource.class);

    private static final CsvSchema SCHEMA = CsvSchema.emptySchema()
        .withColumnSeparator('\t')
        .withoutQuoteChar()
        .withoutEscapeChar();

    private final Path corpusPath;
    private final CsvMapper csvMapper;

    public TsvCorpusSource(Path corpusPath) {
        this.corpusPath = corpusPath;
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    @Override
    public List<CorpusEntry> loadEntries() throws IOException {
        List<CorpusEntry> entries = new ArrayList<>();
        int skipped = 0;
        int line = 0;

        try (Reader reader = Files.newBufferedReader(corpusPath, StandardCharsets.UTF_8);
             MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).with(SCHEMA).readValues(reader)) {
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                line++;
                CorpusEntry entry = parseRow(row);
                if (entry == null) {
                    skipped++;
                    logger.debug("Skipping malformed corpus row {}: {}", line, String.join("\\t", row));
                    continue;
                }
                entries.add(entry);
            }
        }

        if (skipped > 0) {
            logger.warn("Skipped {} malformed rows in corpus {}", skipped, corpusPath);
        }
        if (entries.isEmpty()) {
            throw new CorpusFormatException("Corpus " + corpusPath + " contains no usable entries");
        }

        logger.info("Loaded {} corpus entries from {}", entries.size(), corpusPath);
        return entries;
    }

    private CorpusEntry parseRow(String[] row) {
        if (row.length < 3) {
            return null;
        }
        try {
            int rank = Integer.parseInt(row[0].trim());
            String word = row[1].toLowerCase(Locale.ROOT);
            long frequency = Long.parseLong(row[2].trim());
            if (rank < 1 || frequency < 0) {
                return null;
            }
            return new CorpusEntry(rank, word, frequency);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
