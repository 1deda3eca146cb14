package cz.keywords.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link KeywordsConfig} from YAML and merges command-line overrides into it.
 * <p>
 * An explicit config file must exist and parse. Without one, {@code config.yaml} is looked up on the
 * classpath, and the built-in defaults are used when that is missing or broken.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final KeywordsConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private KeywordsConfig loadDefaultConfig(String configPath) {
        if (configPath != null) {
            Path path = Paths.get(configPath);
            if (!Files.exists(path)) {
                throw new IllegalArgumentException("Config file not found: " + configPath);
            }
            try {
                KeywordsConfig config = yamlMapper.readValue(path.toFile(), KeywordsConfig.class);
                logger.debug("Loaded configuration from {}", path);
                return validate(config);
            } catch (IOException e) {
                throw new IllegalArgumentException("Failed to read config file " + configPath + ": " + e.getMessage(), e);
            }
        }

        try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
            if (resourceStream != null) {
                return validate(yamlMapper.readValue(resourceStream, KeywordsConfig.class));
            }
            logger.warn("No config.yaml found, using default configuration");
            return new KeywordsConfig();
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new KeywordsConfig();
        }
    }

    public KeywordsConfig load() {
        return copyConfig(defaultConfig);
    }

    public KeywordsConfig load(Map<String, Object> userOptions) {
        KeywordsConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "corpus_path":
                case "corpusPath":
                    config.setCorpusPath(value.toString());
                    break;
                case "stop_word_count":
                case "stopWordCount":
                    config.setStopWordCount(parseInt(key, value));
                    break;
                case "min_word_length":
                case "minWordLength":
                    config.setMinWordLength(parseInt(key, value));
                    break;
                case "max_results":
                case "maxResults":
                    config.setMaxResults(parseInt(key, value));
                    break;
                case "language":
                    config.setLanguage(value instanceof OutputLanguage
                        ? (OutputLanguage) value : OutputLanguage.parse(value.toString()));
                    break;
                case "simple_print":
                case "simplePrint":
                    config.setSimplePrint(parseBoolean(value));
                    break;
                case "output_format":
                case "outputFormat":
                    config.setOutputFormat(value instanceof OutputFormat
                        ? (OutputFormat) value : OutputFormat.parse(value.toString()));
                    break;
                case "parallel_lookup":
                case "parallelLookup":
                    config.setParallelLookup(parseBoolean(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return validate(config);
    }

    private KeywordsConfig validate(KeywordsConfig config) {
        if (config.getStopWordCount() < 0) {
            throw new IllegalArgumentException("stopWordCount must not be negative: " + config.getStopWordCount());
        }
        if (config.getMinWordLength() < 1) {
            throw new IllegalArgumentException("minWordLength must be positive: " + config.getMinWordLength());
        }
        if (config.getMaxResults() < 1) {
            throw new IllegalArgumentException("maxResults must be positive: " + config.getMaxResults());
        }
        if (config.getCorpusPath() == null || config.getCorpusPath().isBlank()) {
            throw new IllegalArgumentException("corpusPath must be set");
        }
        if (config.getLanguage() == null) {
            config.setLanguage(OutputLanguage.CZE);
        }
        if (config.getOutputFormat() == null) {
            config.setOutputFormat(OutputFormat.TEXT);
        }
        return config;
    }

    private int parseInt(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key " + key + " expects a number, got: " + value, e);
        }
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private KeywordsConfig copyConfig(KeywordsConfig source) {
        KeywordsConfig copy = new KeywordsConfig();
        copy.setCorpusPath(source.getCorpusPath());
        copy.setStopWordCount(source.getStopWordCount());
        copy.setMinWordLength(source.getMinWordLength());
        copy.setMaxResults(source.getMaxResults());
        copy.setLanguage(source.getLanguage());
        copy.setSimplePrint(source.isSimplePrint());
        copy.setOutputFormat(source.getOutputFormat());
        copy.setParallelLookup(source.isParallelLookup());
        return copy;
    }
}
