package com.todayatsg.backend.ingestion;

import com.todayatsg.backend.config.ClockConfig;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAdjusters;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Reads the date and time notations found on Singapore listing sites.
 * <p>
 * Day-first numeric dates are assumed ({@code 01/08/2024} is 1 August). Dates without a
 * year take the current year, or next year if that day has already passed.
 */
@Component
public class SingaporeDateTimeParser {

    private static final List<DateTimeFormatter> DATE_FORMATS = formatters(
            "yyyy-MM-dd", "d/M/yyyy", "d-M-yyyy", "d.M.yyyy",
            "MMMM d, yyyy", "MMM d, yyyy", "MMMM d yyyy", "MMM d yyyy",
            "d MMMM yyyy", "d MMM yyyy", "d MMMM, yyyy", "d MMM, yyyy",
            "d-MMM-yyyy", "d MMM yy", "d/M/yy");

    private static final List<String> YEARLESS_PATTERNS = List.of("d MMMM", "d MMM", "MMMM d", "MMM d");

    private static final Pattern ISO_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}.*");
    private static final Pattern ORDINAL = Pattern.compile("\\b(\\d{1,2})(st|nd|rd|th)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WEEKDAY_PREFIX = Pattern.compile(
            "^(mon|tue|tues|wed|thu|thur|thurs|fri|sat|sun)[a-z]*\\.?,?\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_WORDS = Pattern.compile(
            "^(date|dates|when|on|from|starts?|starting)\\s*:?\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_RANGE = Pattern.compile("^(\\d{1,2})\\s*[-–—]\\s*\\d{1,2}(\\s+\\p{L}.*)$");
    private static final Pattern RANGE_SEPARATOR = Pattern.compile(
            "\\s+[-–—]\\s+|\\s*[–—]\\s*|\\s+to\\s+|\\s+until\\s+|\\s+till\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_NOISE = Pattern.compile(
            "\\s*(onwards|ongoing|daily|\\(.*\\))\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIME_IN_TEXT = Pattern.compile(
            ",?\\s*(@|at)?\\s*\\d{1,2}([:.]\\d{2})?\\s*(am|pm|a\\.m\\.|p\\.m\\.)"
                    + "|,?\\s*\\b([01]?\\d|2[0-3]):[0-5]\\d\\b.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR = Pattern.compile("\\b(\\d{4})\\b");
    private static final Pattern IN_DAYS = Pattern.compile("^in\\s+(\\d{1,3})\\s+days?$", Pattern.CASE_INSENSITIVE);

    private static final Pattern HOUR_RANGE = Pattern.compile(
            "^(\\d{1,2})(?:[:.](\\d{2}))?\\s*(?:-|–|to)\\s*(\\d{1,2})(?:[:.]\\d{2})?\\s*(am|pm)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TWELVE_HOUR = Pattern.compile(
            "\\b(\\d{1,2})(?:[:.](\\d{2}))?\\s*(am|pm|a\\.m\\.|p\\.m\\.)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TWENTY_FOUR_HOUR = Pattern.compile("\\b([01]?\\d|2[0-3])[:.]([0-5]\\d)\\b");
    private static final Pattern COMPACT_HOUR = Pattern.compile("\\b([01]\\d|2[0-3])([0-5]\\d)\\s*(hrs|h)\\b",
            Pattern.CASE_INSENSITIVE);

    /**
     * Parse an ISO date-time (any offset), returned as Singapore local date-time
     */
    public Optional<LocalDateTime> parseIsoDateTime(String text) {
        if (text == null || !ISO_DATE_TIME.matcher(text.trim()).matches()) return Optional.empty();
        String value = text.trim();
        try {
            return Optional.of(OffsetDateTime.parse(value)
                    .atZoneSameInstant(ClockConfig.SINGAPORE)
                    .toLocalDateTime());
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(value));
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }

    /**
     * Parse the start date of a date or date-range expression
     */
    public Optional<LocalDate> parseDate(String text, LocalDate today) {
        if (text == null || text.isBlank()) return Optional.empty();

        Optional<LocalDateTime> iso = parseIsoDateTime(text);
        if (iso.isPresent()) return Optional.of(iso.get().toLocalDate());

        String value = cleanDateText(text);
        Optional<LocalDate> relative = parseRelative(value, today);
        if (relative.isPresent()) return relative;

        Matcher dayRange = DAY_RANGE.matcher(value);
        if (dayRange.matches()) {
            value = dayRange.group(1) + dayRange.group(2);
        }

        String[] parts = RANGE_SEPARATOR.split(value, 2);
        String start = parts[0].trim();
        if (parts.length > 1 && !YEAR.matcher(start).find()) {
            // "1 Aug - 5 Aug 2024": borrow the year from the end of the range
            Matcher year = YEAR.matcher(parts[1]);
            if (year.find()) {
                Optional<LocalDate> withYear = parseSingle(start + " " + year.group(1), today);
                if (withYear.isPresent()) return withYear;
            }
        }
        return parseSingle(start, today);
    }

    /**
     * End date of a range expression, when the part after the separator is a full date
     */
    public Optional<LocalDate> parseRangeEnd(String text, LocalDate today) {
        if (text == null || text.isBlank() || parseIsoDateTime(text).isPresent()) return Optional.empty();
        String value = cleanDateText(text);
        Matcher dayRange = Pattern.compile("^\\d{1,2}\\s*[-–—]\\s*(\\d{1,2}\\s+\\p{L}.*)$").matcher(value);
        if (dayRange.matches()) {
            return parseSingle(dayRange.group(1), today);
        }
        String[] parts = RANGE_SEPARATOR.split(value, 2);
        return parts.length > 1 ? parseSingle(parts[1].trim(), today) : Optional.empty();
    }

    /**
     * Parse the start time of a time or time-range expression
     */
    public Optional<LocalTime> parseTime(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String value = text.trim().toLowerCase(Locale.ROOT);

        Optional<LocalDateTime> iso = parseIsoDateTime(value.toUpperCase(Locale.ROOT));
        if (iso.isPresent()) return Optional.of(iso.get().toLocalTime());

        if (value.startsWith("noon")) return Optional.of(LocalTime.NOON);
        if (value.startsWith("midnight")) return Optional.of(LocalTime.MIDNIGHT);

        // "7 - 10pm": the meridiem at the end applies to the start too, unless that would
        // put the start after the end ("11 - 2pm" starts at 11am)
        Matcher hourRange = HOUR_RANGE.matcher(value);
        if (hourRange.find()) {
            int start = Integer.parseInt(hourRange.group(1));
            int startMinute = hourRange.group(2) == null ? 0 : Integer.parseInt(hourRange.group(2));
            int end = Integer.parseInt(hourRange.group(3));
            if (start >= 1 && start <= 12 && end >= 1 && end <= 12 && startMinute <= 59) {
                boolean pm = hourRange.group(4).equals("pm") && (start % 12) <= (end % 12);
                return Optional.of(LocalTime.of(start % 12 + (pm ? 12 : 0), startMinute));
            }
        }

        Matcher twelve = TWELVE_HOUR.matcher(value);
        Matcher twentyFour = TWENTY_FOUR_HOUR.matcher(value);
        boolean hasTwelve = twelve.find();
        boolean hasTwentyFour = twentyFour.find();

        // Whichever notation appears first is the start time
        if (hasTwelve && (!hasTwentyFour || twelve.start() <= twentyFour.start())) {
            int hour = Integer.parseInt(twelve.group(1));
            int minute = twelve.group(2) == null ? 0 : Integer.parseInt(twelve.group(2));
            if (hour < 1 || hour > 12 || minute > 59) return Optional.empty();
            boolean pm = twelve.group(3).startsWith("p");
            hour = hour % 12 + (pm ? 12 : 0);
            return Optional.of(LocalTime.of(hour, minute));
        }
        if (hasTwentyFour) {
            return Optional.of(LocalTime.of(Integer.parseInt(twentyFour.group(1)), Integer.parseInt(twentyFour.group(2))));
        }
        Matcher compact = COMPACT_HOUR.matcher(value);
        if (compact.find()) {
            return Optional.of(LocalTime.of(Integer.parseInt(compact.group(1)), Integer.parseInt(compact.group(2))));
        }
        return Optional.empty();
    }

    /**
     * Time of day embedded in a date string such as "Sat, 3 Aug 2024, 7:30 PM"
     */
    public Optional<LocalTime> parseTimeInDateText(String text) {
        if (text == null || parseIsoDateTime(text).isPresent()) return Optional.empty();
        String withoutNumericDates = text.replaceAll("\\d{1,4}[/.-]\\d{1,2}[/.-]\\d{2,4}", " ");
        Matcher twelve = TWELVE_HOUR.matcher(withoutNumericDates);
        if (twelve.find()) return parseTime(twelve.group());
        Matcher twentyFour = Pattern.compile("\\b([01]?\\d|2[0-3]):([0-5]\\d)\\b").matcher(withoutNumericDates);
        return twentyFour.find() ? parseTime(twentyFour.group()) : Optional.empty();
    }

    private Optional<LocalDate> parseSingle(String text, LocalDate today) {
        String value = text.replaceAll("\\s+", " ").trim();
        if (value.isEmpty()) return Optional.empty();

        for (DateTimeFormatter formatter : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(value, formatter));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (String pattern : YEARLESS_PATTERNS) {
            DateTimeFormatter formatter = new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern(pattern)
                    .parseDefaulting(ChronoField.YEAR_OF_ERA, today.getYear())
                    .toFormatter(Locale.ENGLISH);
            try {
                LocalDate date = LocalDate.parse(value, formatter);
                return Optional.of(date.isBefore(today) ? date.plusYears(1) : date);
            } catch (DateTimeParseException ignored) {
                // next format
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private Optional<LocalDate> parseRelative(String value, LocalDate today) {
        String lower = value.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "today", "tonight", "now" -> {
                return Optional.of(today);
            }
            case "tomorrow" -> {
                return Optional.of(today.plusDays(1));
            }
            case "next week" -> {
                return Optional.of(today.plusWeeks(1));
            }
            case "this weekend" -> {
                return Optional.of(today.getDayOfWeek() == DayOfWeek.SATURDAY || today.getDayOfWeek() == DayOfWeek.SUNDAY
                        ? today : today.with(TemporalAdjusters.next(DayOfWeek.SATURDAY)));
            }
            default -> {
                Matcher inDays = IN_DAYS.matcher(lower);
                return inDays.matches() ? Optional.of(today.plusDays(Integer.parseInt(inDays.group(1)))) : Optional.empty();
            }
        }
    }

    private String cleanDateText(String text) {
        String value = text.replace('\u00A0', ' ').trim();
        value = LEADING_WORDS.matcher(value).replaceFirst("");
        value = WEEKDAY_PREFIX.matcher(value).replaceFirst("");
        value = ORDINAL.matcher(value).replaceAll("$1");
        value = TIME_IN_TEXT.matcher(value).replaceAll("");
        value = TRAILING_NOISE.matcher(value).replaceAll("");
        value = value.replaceAll("(?i)\\bsept\\b", "Sep");
        // Weekday names left inside a range ("Fri 2 Aug - Sun 4 Aug")
        value = value.replaceAll("(?i)([-–—]|to)\\s*(mon|tue|wed|thu|fri|sat|sun)[a-z]*\\.?,?\\s+", "$1 ");
        return value.replaceAll("\\s+", " ").replaceAll("[,\\s\\-–—]+$", "").trim();
    }

    private static List<DateTimeFormatter> formatters(String... patterns) {
        return Arrays.stream(patterns)
                .map(pattern -> new DateTimeFormatterBuilder()
                        .parseCaseInsensitive()
                        .appendPattern(pattern)
                        .toFormatter(Locale.ENGLISH))
                .toList();
    }
}
