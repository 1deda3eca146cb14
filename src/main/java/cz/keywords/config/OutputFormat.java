package cz.keywords.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum OutputFormat {
    TEXT,
    JSON;

    @JsonCreator
    public static OutputFormat parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Output format must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output format '" + value + "', expected 'text' or 'json'", e);
        }
    }
}
