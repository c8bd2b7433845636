package com.dcruver.tasklist.query;

import lombok.Value;

import java.util.Locale;

/**
 * Case-insensitive substring filter, optionally negated.
 */
@Value
public class TextFilter {

    private static final String NEGATION_PREFIX = "not ";

    boolean negated;
    String needle;   // lower case

    public static TextFilter contains(String needle) {
        return new TextFilter(false, needle.toLowerCase(Locale.ROOT));
    }

    public static TextFilter notContains(String needle) {
        return new TextFilter(true, needle.toLowerCase(Locale.ROOT));
    }

    /**
     * Parse filter input, "not @waiting" hides everything mentioning "@waiting".
     *
     * @return null for blank input
     */
    public static TextFilter parse(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String text = input.strip();
        if (text.toLowerCase(Locale.ROOT).startsWith(NEGATION_PREFIX)) {
            String needle = text.substring(NEGATION_PREFIX.length()).strip();
            return needle.isEmpty() ? null : notContains(needle);
        }
        return contains(text);
    }

    public boolean matches(String... haystacks) {
        boolean found = false;
        for (String haystack : haystacks) {
            if (haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle)) {
                found = true;
                break;
            }
        }
        return negated != found;
    }
}
