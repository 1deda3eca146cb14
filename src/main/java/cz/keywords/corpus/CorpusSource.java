package cz.keywords.corpus;

import cz.keywords.model.CorpusEntry;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the reference corpus, ordered from the most to the least frequent word.
 */
@FunctionalInterface
public interface CorpusSource {

    List<CorpusEntry> loadEntries() throws IOException;
}
