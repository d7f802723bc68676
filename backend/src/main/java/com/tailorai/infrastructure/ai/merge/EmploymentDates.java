package com.tailorai.infrastructure.ai.merge;

import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Parses the loose date strings found on resumes for date-range comparison.
 * Open or unreadable bounds become sentinels so the range stays as wide as possible.
 */
final class EmploymentDates {

    static final LocalDate OPEN_START = LocalDate.of(1900, 1, 1);
    static final LocalDate OPEN_END = LocalDate.of(2100, 1, 1);

    private static final List<DateTimeFormatter> MONTH_FORMATS = List.of(
            formatter("MMM yyyy"),
            formatter("MMMM yyyy"),
            formatter("MMM. yyyy"),
            formatter("MM/yyyy"),
            formatter("yyyy-MM")
    );

    private static final DateTimeFormatter YEAR_ONLY = formatter("yyyy");

    private EmploymentDates() {
    }

    static LocalDate parse(String value, boolean isEnd) {
        LocalDate sentinel = isEnd ? OPEN_END : OPEN_START;
        if (value == null || value.isBlank()) {
            return sentinel;
        }
        String trimmed = value.strip();
        if (trimmed.equalsIgnoreCase("present") || trimmed.equalsIgnoreCase("current")) {
            return sentinel;
        }

        for (DateTimeFormatter format : MONTH_FORMATS) {
            try {
                return YearMonth.parse(trimmed, format).atDay(1);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            int year = Year.parse(trimmed, YEAR_ONLY).getValue();
            return isEnd ? LocalDate.of(year, 12, 1) : LocalDate.of(year, 1, 1);
        } catch (DateTimeParseException e) {
            return sentinel;
        }
    }

    /**
     * Inclusive overlap of two month ranges.
     */
    static boolean overlaps(String startA, String endA, String startB, String endB) {
        LocalDate aStart = parse(startA, false);
        LocalDate aEnd = parse(endA, true);
        LocalDate bStart = parse(startB, false);
        LocalDate bEnd = parse(endB, true);
        return !aStart.isAfter(bEnd) && !bStart.isAfter(aEnd);
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
