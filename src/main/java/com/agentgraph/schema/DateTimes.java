package com.agentgraph.schema;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Lenient check for the {@code date-time} format. Besides ISO-8601 and RFC 1123 it accepts the
 * common human-written shapes LLM agents produce: {@code 2024-01-15 10:30:00},
 * {@code 2024/01/15} and {@code January 15, 2024}, each with an optional time.
 */
public final class DateTimes {

    /** {@code 2024-01-15 10:30}, {@code 2024-01-15 10:30:00.250+02:00}, {@code ... Z}. */
    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .toFormatter(Locale.ENGLISH);

    /** {@code 2024/01/15}, {@code 2024/01/15 10:30:00}. */
    private static final DateTimeFormatter SLASHED = new DateTimeFormatterBuilder()
            .appendPattern("uuuu/MM/dd")
            .optionalStart()
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .toFormatter(Locale.ENGLISH);

    /** {@code January 15, 2024}, {@code Jan 15, 2024 10:30}. */
    private static final DateTimeFormatter WRITTEN = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("[MMMM][MMM] d, uuuu")
            .optionalStart()
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .toFormatter(Locale.ENGLISH);

    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ISO_DATE_TIME,
            DateTimeFormatter.ISO_INSTANT,
            DateTimeFormatter.ISO_DATE,
            DateTimeFormatter.RFC_1123_DATE_TIME,
            SPACE_SEPARATED,
            SLASHED,
            WRITTEN);

    private DateTimes() {
    }

    public static boolean isParseable(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String trimmed = text.trim();
        return FORMATS.stream().anyMatch(format -> parses(format, trimmed));
    }

    private static boolean parses(DateTimeFormatter format, String text) {
        try {
            format.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
