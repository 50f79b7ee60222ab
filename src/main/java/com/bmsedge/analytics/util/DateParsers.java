package com.bmsedge.analytics.util;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Lenient date parsing for imported files.
 */
public final class DateParsers {

    public static final List<DateTimeFormatter> MARKET_DATA_LAYOUTS = List.of(
            DateTimeFormatter.ofPattern("yyyy-M-d"),
            DateTimeFormatter.ofPattern("yyyy/M/d"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.BASIC_ISO_DATE);

    public static final List<DateTimeFormatter> SALES_LAYOUTS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/M/d"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"));

    private DateParsers() {
    }

    /**
     * Tries each layout in turn, then an RFC 3339 timestamp, then the part before the first
     * space or 'T'.
     */
    public static Optional<LocalDate> parse(String text, List<DateTimeFormatter> layouts) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        Optional<LocalDate> parsed = tryLayouts(value, layouts);
        if (parsed.isPresent()) {
            return parsed;
        }
        try {
            return Optional.of(OffsetDateTime.parse(value).toLocalDate());
        } catch (DateTimeParseException e) {
            // not a timestamp either; fall through to the date part
        }
        int cut = indexOfTimeSeparator(value);
        if (cut > 0) {
            return tryLayouts(value.substring(0, cut), layouts);
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> tryLayouts(String value, List<DateTimeFormatter> layouts) {
        for (DateTimeFormatter layout : layouts) {
            try {
                return Optional.of(LocalDate.parse(value, layout));
            } catch (DateTimeParseException e) {
                // try the next layout
            }
        }
        return Optional.empty();
    }

    private static int indexOfTimeSeparator(String value) {
        int space = value.indexOf(' ');
        int t = value.indexOf('T');
        if (space < 0) {
            return t;
        }
        if (t < 0) {
            return space;
        }
        return Math.min(space, t);
    }
}
