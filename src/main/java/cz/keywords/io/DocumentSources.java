package cz.keywords.io;

import java.nio.file.Path;
import java.util.Locale;

public final class DocumentSources {

    private DocumentSources() {}

    /**
     * Picks the reader by file extension: {@code .pdf} files go through PDFBox, anything else is read as UTF-8 text.
     */
    public static DocumentSource forPath(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".pdf")) {
            return new PdfDocumentSource(path);
        }
        return new TextFileDocumentSource(path);
    }
}
