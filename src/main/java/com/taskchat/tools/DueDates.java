package com.taskchat.tools;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Pattern;

/**
 * Parses the due-date forms accepted from callers and normalizes them to an
 * ISO-8601 instant. Dates without a time mean midnight UTC; date-times without
 * an offset are read as UTC.
 */
public final class DueDates {

    private static final Pattern DATE_ONLY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private DueDates() {
    }

    /**
     * @return the normalized instant text, or null if the value is not a
     *         recognizable date
     */
    public static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        try {
            if (DATE_ONLY.matcher(v).matches()) {
                return LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant().toString();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(v,
                OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant().toString();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC).toString();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static boolean isValid(String value) {
        return normalize(value) != null;
    }
}
