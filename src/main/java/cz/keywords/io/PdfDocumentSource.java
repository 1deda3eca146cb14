package cz.keywords.io;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts the text of all pages of a PDF document using Apache PDFBox.
 */
public class PdfDocumentSource implements DocumentSource {
    private static final Logger logger = LoggerFactory.getLogger(PdfDocumentSource.class);

    private final Path path;

    public PdfDocumentSource(Path path) {
        this.path = path;
    }

    @Override
    public String readAll() throws IOException {
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            String text = stripper.getText(document);
            logger.debug("Extracted {} characters from {} PDF pages", text.length(), document.getNumberOfPages());
            return text;
        }
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
