package cz.keywords.io;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a plain-text document. Input that is not valid in the given charset is rejected.
 */
public class TextFileDocumentSource implements DocumentSource {

    private final Path path;
    private final Charset charset;

    public TextFileDocumentSource(Path path) {
        this(path, StandardCharsets.UTF_8);
    }

    public TextFileDocumentSource(Path path, Charset charset) {
        this.path = path;
        this.charset = charset;
    }

    @Override
    public String readAll() throws IOException {
        return Files.readString(path, charset);
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
