package cz.keywords.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Language of the status lines printed around the keyword list.
 */
public enum OutputLanguage {
    CZE,
    ENG;

    @JsonCreator
    public static OutputLanguage parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Language must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown language '" + value + "', expected 'cze' or 'eng'", e);
        }
    }
}
