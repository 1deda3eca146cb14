package cz.keywords.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes lines to a {@link PrintWriter}, either the console or a UTF-8 file.
 * Closing the sink closes the writer only if the sink opened it.
 */
public class PrintWriterResultSink implements ResultSink, Closeable {

    private final PrintWriter out;
    private final boolean ownsWriter;

    public PrintWriterResultSink(PrintWriter out) {
        this(out, false);
    }

    private PrintWriterResultSink(PrintWriter out, boolean ownsWriter) {
        this.out = out;
        this.ownsWriter = ownsWriter;
    }

    public static PrintWriterResultSink toFile(Path path) throws IOException {
        return new PrintWriterResultSink(new PrintWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8)), true);
    }

    @Override
    public void writeLine(String line) throws IOException {
        out.println(line);
        if (out.checkError()) {
            throw new IOException("Failed to write result line");
        }
    }

    @Override
    public void close() throws IOException {
        out.flush();
        if (ownsWriter) {
            out.close();
        }
        if (out.checkError()) {
            throw new IOException("Failed to flush result output");
        }
    }
}
