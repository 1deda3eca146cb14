package cz.keywords.config;

import lombok.Value;

/**
 * Presentation settings. Only the output layer reads these.
 */
@Value
public class OutputOptions {
    OutputLanguage language;
    boolean simplePrint;
    OutputFormat format;
}
