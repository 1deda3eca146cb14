package cz.keywords.exception;

/**
 * Thrown when no words are left after stop-word and short-word filtering,
 * so the frequency cutoff cannot be computed.
 */
public class EmptyInputException extends KeywordExtractionException {

    private final int tokenCount;

    public EmptyInputException(int tokenCount) {
        super("No words left to analyse after filtering (token count " + tokenCount + ")");
        this.tokenCount = tokenCount;
    }

    public int getTokenCount() {
        return tokenCount;
    }
}
