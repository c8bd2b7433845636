package com.dcruver.tasklist.document;

import com.dcruver.tasklist.config.TaskListProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date ranges of calendar pages, e.g. {@code Journal:2024:03:01} for a day,
 * {@code Journal:2024:Week 09} for an ISO week, {@code Journal:2024:03} for a month
 * and {@code Journal:2024} for a year.
 */
@Component
public class CalendarPages {

    private final Pattern calendarPage;

    @Autowired
    public CalendarPages(TaskListProperties properties) {
        this(properties.getCalendarNamespace());
    }

    public CalendarPages(String namespace) {
        this.calendarPage = Pattern.compile(
            "^" + Pattern.quote(namespace) + ":(\\d{4})(?::(?:Week\\s*(\\d{1,2})|(\\d{1,2})(?::(\\d{1,2}))?))?$");
    }

    /**
     * Last day of the range named by the page, used as implicit due date
     */
    public Optional<LocalDate> deadlineFor(String pageName) {
        Matcher matcher = calendarPage.matcher(pageName);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        try {
            int year = Integer.parseInt(matcher.group(1));
            if (matcher.group(2) != null) {
                int week = Integer.parseInt(matcher.group(2));
                LocalDate monday = LocalDate.of(year, 1, 4)
                    .with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                return Optional.of(monday.plusDays(6));
            }
            if (matcher.group(3) == null) {
                return Optional.of(LocalDate.of(year, 12, 31));
            }
            int month = Integer.parseInt(matcher.group(3));
            if (matcher.group(4) == null) {
                return Optional.of(YearMonth.of(year, month).atEndOfMonth());
            }
            return Optional.of(LocalDate.of(year, month, Integer.parseInt(matcher.group(4))));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
