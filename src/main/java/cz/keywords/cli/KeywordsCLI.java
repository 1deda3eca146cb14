package cz.keywords.cli;

import cz.keywords.config.ConfigLoader;
import cz.keywords.config.KeywordsConfig;
import cz.keywords.config.OutputLanguage;
import cz.keywords.config.PipelineSettings;
import cz.keywords.corpus.CorpusIndex;
import cz.keywords.corpus.TsvCorpusSource;
import cz.keywords.exception.EmptyInputException;
import cz.keywords.exception.KeywordExtractionException;
import cz.keywords.io.DocumentSource;
import cz.keywords.io.DocumentSources;
import cz.keywords.io.PrintWriterResultSink;
import cz.keywords.io.ResultFormatter;
import cz.keywords.model.ExtractionReport;
import cz.keywords.service.KeywordExtractionService;
import cz.keywords.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command-line interface for keyword extraction using Picocli.
 * Help and error messages are always shown in Czech and English.
 */
@Command(
    name = "keywords",
    mixinStandardHelpOptions = true,
    version = "keywords 1.0",
    description = {
        "Extrahuje klíčová slova z českého dokumentu. Bez parametru --simplePrint vypíše i informace o průběhu analýzy.",
        "Parametr --language přepíná jazyk výpisů mezi češtinou (cze, výchozí) a angličtinou (eng).",
        "",
        "Extracts keywords from a Czech document. Without --simplePrint the analysis progress is printed as well.",
        "The --language parameter switches the output language between Czech (cze, default) and English (eng).",
        "",
        "Example: keywords --input inputText.txt --output keywords.txt --simplePrint --language eng"
    }
)
public class KeywordsCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(KeywordsCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_EMPTY_INPUT = 3;

    private final Function<PipelineSettings, KeywordExtractionService> serviceFactory;

    @Spec
    private CommandSpec spec;

    @Option(names = {"--input"}, description = "Vstupní dokument (text nebo PDF) / Input document (text or PDF)")
    private String inputPath;

    @Option(names = {"--output"}, description = "Výstupní soubor, jinak standardní výstup / Output file, standard output if omitted")
    private String outputPath;

    @Option(names = {"--simplePrint"}, description = "Vypsat jen klíčová slova / Print the keywords only")
    private Boolean simplePrint;

    @Option(names = {"--language"}, description = "Jazyk výpisů / Output language: cze, eng")
    private String language;

    @Option(names = {"--corpus"}, description = "Soubor korpusu (TSV) / Corpus file (TSV)")
    private String corpusPath;

    @Option(names = {"--config"}, description = "Konfigurační soubor YAML / YAML configuration file")
    private String configPath;

    @Option(names = {"--format"}, description = "Formát výstupu / Output format: text, json")
    private String format;

    @Option(names = {"--max-results"}, description = "Počet klíčových slov / Number of keywords")
    private Integer maxResults;

    @Option(names = {"--parallel"}, description = "Vyhledávat v korpusu paralelně / Look words up in the corpus in parallel")
    private Boolean parallel;

    public KeywordsCLI() {
        this(KeywordExtractionService::new);
    }

    KeywordsCLI(Function<PipelineSettings, KeywordExtractionService> serviceFactory) {
        this.serviceFactory = serviceFactory;
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();

        if (inputPath == null) {
            err.println("Pro extrahování slov spusťte program s parametry --input (a --output).");
            err.println("To extract keywords, run the program with the --input (and --output) parameters.");
            return EXIT_USAGE;
        }

        KeywordsConfig config;
        try {
            config = new ConfigLoader(configPath).load(collectOverrides());
        } catch (IllegalArgumentException e) {
            if (language != null && !isKnownLanguage(language)) {
                err.println("Definovaný jazyk (--language) musí být 'cze' nebo 'eng'.");
                err.println("The defined --language has to be 'cze' or 'eng'.");
            } else {
                err.println("Neplatná konfigurace / Invalid configuration: " + e.getMessage());
            }
            return EXIT_USAGE;
        }

        Path input = Paths.get(inputPath);
        if (!Files.isRegularFile(input) || !Files.isReadable(input)) {
            err.println("Zadaný --input soubor nebyl nalezen či se ho nepovedlo otevřít.");
            err.println("I could not find or open the --input file.");
            return EXIT_IO_ERROR;
        }

        CorpusIndex corpus;
        try {
            corpus = CorpusIndex.load(new TsvCorpusSource(Paths.get(config.getCorpusPath())));
        } catch (IOException | KeywordExtractionException e) {
            logger.error("Failed to load corpus {}", config.getCorpusPath(), e);
            err.println("Korpus " + config.getCorpusPath() + " se nepovedlo načíst.");
            err.println("I could not load the corpus " + config.getCorpusPath() + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        ExtractionReport report;
        DocumentSource document = DocumentSources.forPath(input);
        try {
            report = serviceFactory.apply(config.toPipelineSettings()).extract(document, corpus);
        } catch (EmptyInputException e) {
            err.println("Po odstranění stop slov a krátkých slov v dokumentu nezůstalo žádné slovo.");
            err.println("No words are left in the document after removing stop words and short words.");
            return EXIT_EMPTY_INPUT;
        } catch (KeywordExtractionException e) {
            logger.error("Keyword extraction failed for {}", input, e);
            err.println("Extrahování klíčových slov selhalo: " + e.getMessage());
            err.println("Keyword extraction failed: " + e.getMessage());
            return EXIT_IO_ERROR;
        } catch (IOException e) {
            logger.error("Failed to read input document {}", input, e);
            err.println("Zadaný --input soubor nebyl nalezen či se ho nepovedlo otevřít.");
            err.println("I could not find or open the --input file.");
            return EXIT_IO_ERROR;
        }

        ResultFormatter formatter = new ResultFormatter(config.toOutputOptions());
        try {
            if (outputPath != null) {
                try (PrintWriterResultSink sink = PrintWriterResultSink.toFile(Paths.get(outputPath))) {
                    formatter.write(report, sink);
                }
            } else {
                PrintWriterResultSink sink = new PrintWriterResultSink(spec.commandLine().getOut());
                formatter.write(report, sink);
                sink.close();
            }
        } catch (IOException e) {
            logger.error("Failed to write results", e);
            err.println("Zadaný --output soubor se nepovedlo otevřít či vytvořit.");
            err.println("I could not open or create the --output file.");
            return EXIT_IO_ERROR;
        }

        return EXIT_OK;
    }

    private Map<String, Object> collectOverrides() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("simplePrint", simplePrint);
        overrides.put("language", language);
        overrides.put("corpusPath", corpusPath);
        overrides.put("outputFormat", format);
        overrides.put("maxResults", maxResults);
        overrides.put("parallelLookup", parallel);
        return overrides;
    }

    private static boolean isKnownLanguage(String value) {
        try {
            OutputLanguage.parse(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new KeywordsCLI());
        commandLine.setOut(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
        commandLine.setErr(new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true));
        return commandLine;
    }

    public static void main(String[] args) {
        try {
            CommandLine commandLine = createCommandLine();
            int exitCode;
            if (args.length == 0) {
                commandLine.usage(commandLine.getOut());
                exitCode = EXIT_OK;
            } else {
                exitCode = commandLine.execute(args);
            }
            System.exit(exitCode);
        } finally {
            ExecutorProvider.shutdown();
        }
    }
}
