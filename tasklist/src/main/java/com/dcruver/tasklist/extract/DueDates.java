package com.dcruver.tasklist.extract;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Due date directives of the form {@code [d:2024-03-01]} and the stored date format.
 */
public final class DueDates {

    /**
     * Stored value for "no due date"; sorts after every ISO date
     */
    public static final String NO_DATE = "9999";

    private static final Pattern DIRECTIVE = Pattern.compile("\\s*\\[d:([^\\]]+)\\]");

    private static final Pattern YEAR_FIRST = Pattern.compile("^(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})$");
    private static final Pattern DAY_FIRST = Pattern.compile("^(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{4})$");

    private DueDates() {
    }

    /**
     * Result of extracting a directive: the date (null if none was taken) and
     * the text with the consumed directive removed.
     */
    public record Extraction(LocalDate date, String text) {}

    /**
     * Take the first directive whose value parses as a date out of the text.
     * Directives that do not parse, and any after the first date, stay in place.
     */
    public static Extraction extract(String text) {
        Matcher matcher = DIRECTIVE.matcher(text);
        while (matcher.find()) {
            LocalDate date = parseDate(matcher.group(1).trim());
            if (date != null) {
                String remaining = text.substring(0, matcher.start()) + text.substring(matcher.end());
                return new Extraction(date, remaining);
            }
        }
        return new Extraction(null, text);
    }

    /**
     * Parse a date value, returns null when it is not a valid calendar date
     */
    public static LocalDate parseDate(String value) {
        for (Pattern format : List.of(YEAR_FIRST, DAY_FIRST)) {
            Matcher matcher = format.matcher(value);
            if (!matcher.matches()) {
                continue;
            }
            try {
                if (format == YEAR_FIRST) {
                    return LocalDate.of(Integer.parseInt(matcher.group(1)),
                        Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(3)));
                }
                return LocalDate.of(Integer.parseInt(matcher.group(3)),
                    Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(1)));
            } catch (DateTimeException e) {
                return null;
            }
        }
        return null;
    }

    public static String toStored(LocalDate due) {
        return due != null ? due.toString() : NO_DATE;
    }

    public static LocalDate fromStored(String stored) {
        if (stored == null || NO_DATE.equals(stored)) {
            return null;
        }
        try {
            return LocalDate.parse(stored);
        } catch (DateTimeException e) {
            return null;
        }
    }
}
