package cz.keywords.io;

import java.io.IOException;

/**
 * Destination for output lines.
 */
@FunctionalInterface
public interface ResultSink {

    void writeLine(String line) throws IOException;
}
