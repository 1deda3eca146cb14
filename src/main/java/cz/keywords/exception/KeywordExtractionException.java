package cz.keywords.exception;

/**
 * Base class for failures of the keyword extraction pipeline.
 */
public class KeywordExtractionException extends RuntimeException {

    public KeywordExtractionException(String message) {
        super(message);
    }

    public KeywordExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
