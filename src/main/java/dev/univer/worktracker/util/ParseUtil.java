package dev.univer.worktracker.util;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ParseUtil {
    private static final DateTimeFormatter DATE_DOTS = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    // "/me <name> [date]" where the date is optional and trailing
    private static final Pattern NAME_THEN_DATE =
            Pattern.compile("^(?<name>.+?)(?:\\s+(?<date>\\d{4}-\\d{2}-\\d{2}|\\d{2}[./]\\d{2}[./]\\d{4}))?\\s*$");

    public record NameAndDate(String name, String date) {}

    /** ISO yyyy-MM-dd or dd.MM.yyyy (also dd/MM/yyyy); null when unparseable. */
    public static LocalDate parseFlexibleDate(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim();
        try {
            if (v.contains(".") || v.contains("/")) {
                return LocalDate.parse(v.replace('/', '.'), DATE_DOTS);
            }
            return LocalDate.parse(v);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Strict ISO calendar date, as the API accepts it; null when malformed. */
    public static LocalDate parseIsoDate(String raw) {
        if (raw == null) return null;
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static LocalDate mondayOf(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public static NameAndDate parseNameAndDate(String text) {
        if (text == null) return null;
        Matcher m = NAME_THEN_DATE.matcher(text.trim());
        if (!m.matches()) return null;
        return new NameAndDate(m.group("name").trim(), m.group("date"));
    }

    public static String formatDots(LocalDate date) {
        return date.format(DATE_DOTS);
    }
}
