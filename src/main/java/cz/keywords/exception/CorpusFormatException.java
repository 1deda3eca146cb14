package cz.keywords.exception;

/**
 * Thrown when a corpus file yields no usable entries.
 */
public class CorpusFormatException extends KeywordExtractionException {

    public CorpusFormatException(String message) {
        super(message);
    }
}
