package com.neoexplorer.backend.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.Locale;

/**
 * Conversions between close-approach timestamps and their text forms.
 * <p>
 * Source data uses the compact {@code 1900-Jan-01 00:00} form; output uses
 * {@code 1900-01-01 00:00}. Both carry minute precision and are UTC.
 */
public final class ApproachTimes {

    private static final DateTimeFormatter CALENDAR_DATE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("uuuu-MMM-dd HH:mm")
            .toFormatter(Locale.ENGLISH);

    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm", Locale.ROOT);

    private ApproachTimes() {
    }

    public static LocalDateTime parse(String calendarDate) {
        return LocalDateTime.parse(calendarDate.trim(), CALENDAR_DATE);
    }

    // seconds dropped
    public static String format(LocalDateTime time) {
        return DISPLAY.format(time);
    }
}
