package cz.keywords.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a document into lowercase word tokens.
 * <p>
 * Every maximal run of non-whitespace characters is a candidate word. Punctuation and digits
 * from {@link #STRIPPED_CHARACTERS} are deleted from the run (so {@code don't} becomes {@code dont})
 * and the remainder is lowercased. Diacritics are kept: {@code Kočka} becomes {@code kočka}, never {@code kocka}.
 * Runs consisting only of stripped characters produce no token.
 */
public class Tokenizer {

    public static final String STRIPPED_CHARACTERS = ".,!?;:\"'()–[]{}|0123456789";

    private static final Pattern WORD_RUN = Pattern.compile("\\S+", Pattern.UNICODE_CHARACTER_CLASS);

    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        Matcher matcher = WORD_RUN.matcher(text);
        while (matcher.find()) {
            String token = normalize(matcher.group());
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Deletes the stripped characters from a single run and lowercases it.
     */
    public String normalize(String run) {
        StringBuilder sb = new StringBuilder(run.length());
        for (int i = 0; i < run.length(); i++) {
            char c = run.charAt(i);
            if (STRIPPED_CHARACTERS.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
