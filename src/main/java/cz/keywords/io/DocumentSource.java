package cz.keywords.io;

import java.io.IOException;

/**
 * Supplies the full decoded text of the document to analyse.
 */
@FunctionalInterface
public interface DocumentSource {

    String readAll() throws IOException;
}
